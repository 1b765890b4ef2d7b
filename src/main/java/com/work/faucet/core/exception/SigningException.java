package com.work.faucet.core.exception;

/**
 * 交易签名失败，通常意味着签名凭据已损坏。
 */
public class SigningException extends FaucetException {

    public SigningException(String message, Throwable cause) {
        super(FaucetErrorCode.SIGNING_FAILED, message, cause);
    }
}
