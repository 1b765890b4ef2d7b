package com.work.faucet.core.exception;

/**
 * 组件内部的统一异常类型，便于宿主侧捕获并转换为 HTTP 响应。
 */
public class FaucetException extends RuntimeException {

    private final FaucetErrorCode errorCode;

    public FaucetException(FaucetErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FaucetException(FaucetErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public FaucetErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 标识调用方是否可以直接重试（不需要等待 cooldown）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
