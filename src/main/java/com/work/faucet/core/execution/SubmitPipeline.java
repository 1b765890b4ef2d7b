package com.work.faucet.core.execution;

import com.work.faucet.core.exception.PipelineBusyException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static com.work.faucet.core.support.ValidationUtils.requireNonNull;
import static com.work.faucet.core.support.ValidationUtils.requirePositive;

/**
 * 出账账户的串行提交流水线。
 * <p>
 * 同一时刻只有一个请求处于 “复核资格 - 取 nonce - 估 gas - 签名 - 提交 - 记录” 区间内：
 * - 同一地址的并发请求只会有一个出账成功
 * - pending nonce 在提交前不会被另一个请求读到同一个值
 * 等待进入流水线的时间有上限，超过则以 {@link PipelineBusyException} 拒绝。
 */
public class SubmitPipeline {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Duration waitTimeout;

    public SubmitPipeline(Duration waitTimeout) {
        this.waitTimeout = requirePositive(waitTimeout, "waitTimeout");
    }

    public <T> T execute(Callable<T> work) {
        requireNonNull(work, "work");
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineBusyException("faucet is busy, interrupted while waiting, please retry");
        }
        if (!acquired) {
            throw new PipelineBusyException("faucet is busy, please retry later");
        }
        try {
            return work.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(Objects.requireNonNullElse(e.getMessage(), "pipeline execute failed"), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前排队等待进入流水线的线程数（近似值）。
     */
    public int getQueueLength() {
        return lock.getQueueLength();
    }
}
