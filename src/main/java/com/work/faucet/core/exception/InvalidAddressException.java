package com.work.faucet.core.exception;

/**
 * 收款地址格式非法。在任何链上调用之前抛出，无副作用。
 */
public class InvalidAddressException extends FaucetException {

    public InvalidAddressException(String message) {
        super(FaucetErrorCode.INVALID_ADDRESS, message);
    }
}
