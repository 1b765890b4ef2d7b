package com.work.faucet.core.exception;

/**
 * 在限定时间内未能进入提交流水线（前面的请求仍在与节点交互）。
 */
public class PipelineBusyException extends FaucetException {

    public PipelineBusyException(String message) {
        super(FaucetErrorCode.PIPELINE_BUSY, message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
