package com.work.faucet.core.chain;

import com.work.faucet.core.exception.FaucetErrorCode;

/**
 * 对节点的每一类调用，决定失败时的错误码与对外描述。
 */
public enum LedgerOperation {

    CHAIN_ID("failed to get chain ID", FaucetErrorCode.CHAIN_ID_FETCH_FAILED),
    PENDING_NONCE("failed to get nonce", FaucetErrorCode.NONCE_FETCH_FAILED),
    GAS_PRICE("failed to get gas price", FaucetErrorCode.GAS_PRICE_FETCH_FAILED),
    GAS_ESTIMATE("failed to estimate gas", FaucetErrorCode.GAS_ESTIMATE_FAILED),
    SUBMIT("failed to send transaction", FaucetErrorCode.SUBMISSION_FAILED),
    BALANCE("failed to get balance", FaucetErrorCode.BALANCE_QUERY_FAILED);

    private final String failureMessage;
    private final FaucetErrorCode errorCode;

    LedgerOperation(String failureMessage, FaucetErrorCode errorCode) {
        this.failureMessage = failureMessage;
        this.errorCode = errorCode;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public FaucetErrorCode getErrorCode() {
        return errorCode;
    }
}
