package com.work.faucet.core;

import com.work.faucet.core.chain.LedgerCallExecutor;
import com.work.faucet.core.chain.LedgerClient;
import com.work.faucet.core.chain.LedgerOperation;
import com.work.faucet.core.cooldown.CooldownTable;
import com.work.faucet.core.exception.FaucetException;
import com.work.faucet.core.execution.SubmitPipeline;
import com.work.faucet.core.model.Disbursement;
import com.work.faucet.core.model.PendingTransfer;
import com.work.faucet.core.model.SignedTransfer;
import com.work.faucet.core.signer.TransferSigner;
import com.work.faucet.core.support.metrics.FaucetMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Instant;
import java.util.concurrent.Callable;

import static com.work.faucet.core.support.ValidationUtils.requireNonNull;
import static com.work.faucet.core.support.ValidationUtils.requireValidAddress;

/**
 * 限频出账引擎：校验地址 -> 判断 cooldown -> 构造/签名/提交交易 -> 成功后记录。
 * <p>
 * 复核资格到记录之间的全部步骤都在 {@link SubmitPipeline} 内串行执行，因此：
 * - 同一地址的并发请求最多一个成功
 * - 每笔交易读取到的 pending nonce 互不相同
 * 任何失败都不会写 cooldown 表。
 */
public class DisbursementEngine {

    private static final Logger log = LoggerFactory.getLogger(DisbursementEngine.class);

    private final LedgerClient ledger;
    private final LedgerCallExecutor calls;
    private final TransferSigner signer;
    private final CooldownTable cooldownTable;
    private final SubmitPipeline pipeline;
    private final BigInteger amount;
    private final FaucetMetrics metrics;

    public DisbursementEngine(LedgerClient ledger,
                              LedgerCallExecutor calls,
                              TransferSigner signer,
                              CooldownTable cooldownTable,
                              SubmitPipeline pipeline,
                              BigInteger amount,
                              FaucetMetrics metrics) {
        this.ledger = requireNonNull(ledger, "ledger");
        this.calls = requireNonNull(calls, "calls");
        this.signer = requireNonNull(signer, "signer");
        this.cooldownTable = requireNonNull(cooldownTable, "cooldownTable");
        this.pipeline = requireNonNull(pipeline, "pipeline");
        this.amount = requireNonNull(amount, "amount");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 向 {@code address} 发放一次固定金额。
     *
     * @return 成功提交的交易信息（含 txHash）
     * @throws FaucetException 任意失败，错误码见 {@link com.work.faucet.core.exception.FaucetErrorCode}
     */
    public Disbursement requestDisbursement(String address) {
        try {
            String recipient = requireValidAddress(address);
            // 流水线外的快速拒绝，避免 cooldown 内的请求排队
            cooldownTable.requireEligible(recipient);
            metrics.pipelineQueueDepth(pipeline.getQueueLength());
            Disbursement d = pipeline.execute(() -> disburse(recipient));
            metrics.disbursement("success");
            return d;
        } catch (FaucetException e) {
            metrics.disbursement(e.getErrorCode().name());
            throw e;
        }
    }

    private Disbursement disburse(String recipient) {
        cooldownTable.requireEligible(recipient);

        String from = signer.getAccount().getAddress();
        BigInteger nonce = timed(LedgerOperation.PENDING_NONCE, () -> ledger.getPendingNonce(from));
        BigInteger gasPrice = timed(LedgerOperation.GAS_PRICE, ledger::suggestGasPrice);
        BigInteger gasLimit = timed(LedgerOperation.GAS_ESTIMATE, () -> ledger.estimateGas(from, recipient, amount));

        PendingTransfer transfer = new PendingTransfer(nonce, recipient, amount, gasPrice, gasLimit,
                signer.getChainIdentity().getChainId());
        SignedTransfer signed = signer.sign(transfer);

        String nodeHash = timed(LedgerOperation.SUBMIT, () -> ledger.submitTransaction(signed.getRawHex()));
        if (!signed.getTxHash().equalsIgnoreCase(nodeHash)) {
            log.warn("node returned unexpected txHash. local={} node={}", signed.getTxHash(), nodeHash);
        }

        Instant now = cooldownTable.now();
        cooldownTable.record(recipient, now);
        log.info("disbursed amount={} to={} nonce={} gasPrice={} gas={} txHash={}",
                amount, recipient, nonce, gasPrice, gasLimit, signed.getTxHash());
        return new Disbursement(signed.getTxHash(), recipient, nonce, amount, now);
    }

    private <T> T timed(LedgerOperation operation, Callable<T> call) {
        long start = System.nanoTime();
        try {
            return calls.call(operation, call);
        } finally {
            metrics.ledgerCall(operation.name(), (System.nanoTime() - start) / 1_000_000L);
        }
    }

    public BigInteger getAmount() {
        return amount;
    }

    public CooldownTable getCooldownTable() {
        return cooldownTable;
    }
}
