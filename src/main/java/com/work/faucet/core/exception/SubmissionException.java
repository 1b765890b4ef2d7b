package com.work.faucet.core.exception;

/**
 * 节点拒绝或网络错误导致交易未被受理；cooldown 表不更新，可立即重试。
 */
public class SubmissionException extends FaucetException {

    public SubmissionException(String message, Throwable cause) {
        super(FaucetErrorCode.SUBMISSION_FAILED, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
