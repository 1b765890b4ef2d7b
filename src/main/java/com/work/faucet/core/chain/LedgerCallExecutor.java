package com.work.faucet.core.chain;

import com.work.faucet.core.exception.FaucetConfigurationException;
import com.work.faucet.core.exception.LedgerQueryException;
import com.work.faucet.core.exception.SubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.faucet.core.support.ValidationUtils.requireNonNull;
import static com.work.faucet.core.support.ValidationUtils.requirePositive;

/**
 * 为每一次节点调用提供独立、可取消的超时。
 * <p>
 * 调用在独立线程上执行，调用方最多等待 {@code callTimeout}；超时后中断该调用并按
 * {@link LedgerOperation} 转换为对应的异常。某一次调用挂起不会影响其他请求的调用。
 */
public class LedgerCallExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LedgerCallExecutor.class);

    private final ExecutorService callers;
    private final Duration callTimeout;

    public LedgerCallExecutor(Duration callTimeout) {
        this.callTimeout = requirePositive(callTimeout, "callTimeout");
        AtomicInteger seq = new AtomicInteger();
        this.callers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ledger-call-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public <T> T call(LedgerOperation operation, Callable<T> call) {
        requireNonNull(operation, "operation");
        requireNonNull(call, "call");
        Future<T> future = callers.submit(call);
        try {
            T result = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw failure(operation, "empty response from node", null);
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("ledger call timed out. op={} timeout={}", operation, callTimeout);
            throw failure(operation, "timed out after " + callTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw failure(operation, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw failure(operation, describe(cause), cause);
        }
    }

    private RuntimeException failure(LedgerOperation operation, String detail, Throwable cause) {
        String message = operation.getFailureMessage() + ": " + detail;
        switch (operation) {
            case SUBMIT:
                return new SubmissionException(message, cause);
            case CHAIN_ID:
                return new FaucetConfigurationException(operation.getErrorCode(), message, cause);
            default:
                return new LedgerQueryException(operation, message, cause);
        }
    }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        return msg == null || msg.trim().isEmpty() ? cause.getClass().getSimpleName() : msg;
    }

    @Override
    public void close() {
        callers.shutdownNow();
    }
}
