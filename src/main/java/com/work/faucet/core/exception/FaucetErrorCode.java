package com.work.faucet.core.exception;

/**
 * 对外可见的错误码，一个请求失败时恰好对应其中一个。
 */
public enum FaucetErrorCode {

    CONFIGURATION_INVALID,
    CHAIN_ID_FETCH_FAILED,
    INVALID_ADDRESS,
    COOLDOWN_ACTIVE,
    NONCE_FETCH_FAILED,
    GAS_PRICE_FETCH_FAILED,
    GAS_ESTIMATE_FAILED,
    BALANCE_QUERY_FAILED,
    SIGNING_FAILED,
    SUBMISSION_FAILED,
    PIPELINE_BUSY
}
