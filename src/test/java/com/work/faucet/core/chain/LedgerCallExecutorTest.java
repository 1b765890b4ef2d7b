package com.work.faucet.core.chain;

import com.work.faucet.core.exception.FaucetConfigurationException;
import com.work.faucet.core.exception.FaucetErrorCode;
import com.work.faucet.core.exception.LedgerQueryException;
import com.work.faucet.core.exception.SubmissionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LedgerCallExecutorTest {

    private final LedgerCallExecutor calls = new LedgerCallExecutor(Duration.ofMillis(200));

    @AfterEach
    public void tearDown() {
        calls.close();
    }

    @Test
    public void returns_value_of_successful_call() {
        assertEquals(BigInteger.TEN, calls.call(LedgerOperation.GAS_PRICE, () -> BigInteger.TEN));
    }

    @Test
    public void hung_call_times_out_and_is_interrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        long start = System.nanoTime();
        LedgerQueryException e = assertThrows(LedgerQueryException.class, () -> calls.call(LedgerOperation.PENDING_NONCE, () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ie) {
                interrupted.countDown();
                throw ie;
            }
            return BigInteger.ONE;
        }));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(FaucetErrorCode.NONCE_FETCH_FAILED, e.getErrorCode());
        assertEquals(LedgerOperation.PENDING_NONCE, e.getOperation());
        assertTrue(e.getMessage().startsWith("failed to get nonce: timed out"), e.getMessage());
        assertTrue(elapsedMs < 5_000, "elapsed=" + elapsedMs);
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    public void submit_failure_carries_node_message() {
        SubmissionException e = assertThrows(SubmissionException.class, () -> calls.call(LedgerOperation.SUBMIT, () -> {
            throw new IllegalStateException("insufficient funds for gas * price + value");
        }));
        assertEquals("failed to send transaction: insufficient funds for gas * price + value", e.getMessage());
        assertTrue(e.isRetryable());
    }

    @Test
    public void query_failures_map_to_operation_error_codes() {
        LedgerQueryException gas = assertThrows(LedgerQueryException.class, () -> calls.call(LedgerOperation.GAS_ESTIMATE, () -> {
            throw new IllegalStateException("execution reverted");
        }));
        assertEquals(FaucetErrorCode.GAS_ESTIMATE_FAILED, gas.getErrorCode());

        LedgerQueryException balance = assertThrows(LedgerQueryException.class, () -> calls.call(LedgerOperation.BALANCE, () -> {
            throw new RuntimeException(new java.io.IOException("connection refused"));
        }));
        assertEquals(FaucetErrorCode.BALANCE_QUERY_FAILED, balance.getErrorCode());
    }

    @Test
    public void chain_id_failure_is_a_configuration_error() {
        FaucetConfigurationException e = assertThrows(FaucetConfigurationException.class, () -> calls.call(LedgerOperation.CHAIN_ID, () -> {
            throw new IllegalStateException("connection refused");
        }));
        assertEquals(FaucetErrorCode.CHAIN_ID_FETCH_FAILED, e.getErrorCode());
    }

    @Test
    public void empty_response_is_a_failure() {
        LedgerQueryException e = assertThrows(LedgerQueryException.class,
                () -> calls.call(LedgerOperation.GAS_PRICE, () -> null));
        assertEquals("failed to get gas price: empty response from node", e.getMessage());
    }
}
