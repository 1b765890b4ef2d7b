package com.work.faucet.core.exception;

import com.work.faucet.core.chain.LedgerOperation;

/**
 * 只读链上查询失败（nonce / gasPrice / estimateGas / balance）。
 * 不会产生任何出账，也不会更新 cooldown 表。
 */
public class LedgerQueryException extends FaucetException {

    private final LedgerOperation operation;

    public LedgerQueryException(LedgerOperation operation, String message, Throwable cause) {
        super(operation.getErrorCode(), message, cause);
        this.operation = operation;
    }

    public LedgerOperation getOperation() {
        return operation;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
