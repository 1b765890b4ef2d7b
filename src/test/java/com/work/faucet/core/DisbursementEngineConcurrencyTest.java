package com.work.faucet.core;

import com.work.faucet.core.chain.ChainIdentity;
import com.work.faucet.core.chain.LedgerCallExecutor;
import com.work.faucet.core.chain.LedgerClient;
import com.work.faucet.core.cooldown.CooldownTable;
import com.work.faucet.core.exception.CooldownActiveException;
import com.work.faucet.core.execution.SubmitPipeline;
import com.work.faucet.core.model.Disbursement;
import com.work.faucet.core.signer.FaucetAccount;
import com.work.faucet.core.signer.TransferSigner;
import com.work.faucet.core.support.InMemoryLedgerClient;
import com.work.faucet.core.support.MutableClock;
import com.work.faucet.core.support.TestAccounts;
import com.work.faucet.core.support.metrics.NoopFaucetMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class DisbursementEngineConcurrencyTest {

    private static final long CHAIN_ID = 1337L;

    private final FaucetAccount account = FaucetAccount.fromPrivateKeyHex(TestAccounts.FAUCET_KEY);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final LedgerCallExecutor calls = new LedgerCallExecutor(Duration.ofSeconds(5));
    private final ExecutorService requests = Executors.newFixedThreadPool(16);

    @AfterEach
    public void tearDown() {
        requests.shutdownNow();
        calls.close();
    }

    private DisbursementEngine engine(LedgerClient ledger, CooldownTable table) {
        return new DisbursementEngine(ledger, calls, new TransferSigner(account, new ChainIdentity(CHAIN_ID)),
                table, new SubmitPipeline(Duration.ofSeconds(10)), BigInteger.valueOf(1000), new NoopFaucetMetrics());
    }

    @Test
    public void concurrent_requests_for_same_address_disburse_exactly_once() throws Exception {
        CountDownLatch submitEntered = new CountDownLatch(1);
        CountDownLatch releaseSubmit = new CountDownLatch(1);

        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.getPendingNonce(anyString())).thenReturn(BigInteger.ZERO);
        when(ledger.suggestGasPrice()).thenReturn(BigInteger.ONE);
        when(ledger.estimateGas(anyString(), anyString(), any(BigInteger.class))).thenReturn(BigInteger.valueOf(21_000));
        when(ledger.submitTransaction(anyString())).thenAnswer(inv -> {
            submitEntered.countDown();
            releaseSubmit.await(5, TimeUnit.SECONDS);
            return Hash.sha3(inv.getArgument(0, String.class));
        });

        CooldownTable table = new CooldownTable(Duration.ofHours(1), Duration.ofHours(2), clock);
        DisbursementEngine engine = engine(ledger, table);

        CountDownLatch start = new CountDownLatch(1);
        List<Future<Disbursement>> futures = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            futures.add(requests.submit(() -> {
                start.await();
                return engine.requestDisbursement(TestAccounts.RECIPIENT);
            }));
        }
        start.countDown();

        // 第一笔停在 submit 内，第二笔此时要么在流水线外排队，要么已被快速拒绝
        assertTrue(submitEntered.await(5, TimeUnit.SECONDS));
        Thread.sleep(200);
        releaseSubmit.countDown();

        int success = 0;
        int cooldown = 0;
        for (Future<Disbursement> f : futures) {
            try {
                f.get(10, TimeUnit.SECONDS);
                success++;
            } catch (ExecutionException e) {
                assertTrue(e.getCause() instanceof CooldownActiveException, String.valueOf(e.getCause()));
                cooldown++;
            }
        }
        assertEquals(1, success);
        assertEquals(1, cooldown);
        verify(ledger, times(1)).submitTransaction(anyString());
    }

    @Test
    public void concurrent_requests_for_distinct_addresses_get_distinct_sequential_nonces() throws Exception {
        int n = 16;
        InMemoryLedgerClient ledger = new InMemoryLedgerClient(CHAIN_ID);
        ledger.credit(account.getAddress(), BigInteger.TEN.pow(20));
        CooldownTable table = new CooldownTable(Duration.ofHours(1), Duration.ofHours(2), clock);
        DisbursementEngine engine = engine(ledger, table);

        CountDownLatch start = new CountDownLatch(1);
        List<Future<Disbursement>> futures = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            String recipient = TestAccounts.recipient(i);
            futures.add(requests.submit(() -> {
                start.await();
                return engine.requestDisbursement(recipient);
            }));
        }
        start.countDown();

        Set<BigInteger> nonces = new HashSet<>();
        Set<String> hashes = new HashSet<>();
        for (Future<Disbursement> f : futures) {
            Disbursement d = f.get(20, TimeUnit.SECONDS);
            nonces.add(d.getNonce());
            hashes.add(d.getTxHash());
        }
        assertEquals(n, nonces.size());
        assertEquals(n, hashes.size());

        List<InMemoryLedgerClient.AcceptedTransaction> accepted = ledger.getAcceptedTransactions();
        assertEquals(n, accepted.size());
        for (int i = 0; i < n; i++) {
            assertEquals(BigInteger.valueOf(i), accepted.get(i).getNonce());
        }
        assertEquals(BigInteger.valueOf(n), ledger.getPendingNonce(account.getAddress()));
    }
}
