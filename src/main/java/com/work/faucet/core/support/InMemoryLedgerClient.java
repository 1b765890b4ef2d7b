package com.work.faucet.core.support;

import com.work.faucet.core.chain.LedgerClient;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.SignedRawTransaction;
import org.web3j.crypto.TransactionDecoder;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.work.faucet.core.support.ValidationUtils.requireNonEmpty;
import static com.work.faucet.core.support.ValidationUtils.requireNonNull;

/**
 * 纯内存账本，方便在没有节点的环境下运行与测试。
 * <p>
 * 与真实节点一致的最小校验：签名可恢复出 sender、chainId 匹配、nonce 必须等于 sender 的下一个 nonce、
 * 余额足以覆盖 value + gasLimit * gasPrice。不具备跨进程一致性。
 */
public class InMemoryLedgerClient implements LedgerClient {

    public static final BigInteger TRANSFER_GAS = BigInteger.valueOf(21_000L);
    public static final BigInteger DEFAULT_GAS_PRICE = BigInteger.valueOf(1_000_000_000L);

    private final long chainId;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Map<String, BigInteger> nonces = new HashMap<>();
    private final List<AcceptedTransaction> accepted = new ArrayList<>();
    private volatile BigInteger gasPrice = DEFAULT_GAS_PRICE;

    public InMemoryLedgerClient(long chainId) {
        this.chainId = chainId;
    }

    public synchronized void credit(String account, BigInteger amount) {
        balances.merge(key(account), requireNonNull(amount, "amount"), BigInteger::add);
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = requireNonNull(gasPrice, "gasPrice");
    }

    @Override
    public synchronized BigInteger getPendingNonce(String account) {
        return nonces.getOrDefault(key(account), BigInteger.ZERO);
    }

    @Override
    public BigInteger suggestGasPrice() {
        return gasPrice;
    }

    @Override
    public BigInteger estimateGas(String from, String to, BigInteger value) {
        requireNonEmpty(from, "from");
        requireNonEmpty(to, "to");
        return TRANSFER_GAS;
    }

    @Override
    public synchronized String submitTransaction(String signedTransactionHex) {
        requireNonEmpty(signedTransactionHex, "signedTransactionHex");
        RawTransaction decoded = TransactionDecoder.decode(signedTransactionHex);
        if (!(decoded instanceof SignedRawTransaction)) {
            throw new IllegalStateException("transaction is not signed");
        }
        SignedRawTransaction tx = (SignedRawTransaction) decoded;
        Long txChainId = tx.getChainId();
        if (txChainId == null || txChainId != chainId) {
            throw new IllegalStateException("invalid chain id for signer");
        }
        String from;
        try {
            from = key(tx.getFrom());
        } catch (SignatureException e) {
            throw new IllegalStateException("invalid sender: " + e.getMessage(), e);
        }

        BigInteger expected = nonces.getOrDefault(from, BigInteger.ZERO);
        int cmp = tx.getNonce().compareTo(expected);
        if (cmp < 0) {
            throw new IllegalStateException("nonce too low: next nonce " + expected + ", tx nonce " + tx.getNonce());
        }
        if (cmp > 0) {
            throw new IllegalStateException("nonce too high: next nonce " + expected + ", tx nonce " + tx.getNonce());
        }

        BigInteger cost = tx.getValue().add(tx.getGasLimit().multiply(tx.getGasPrice()));
        BigInteger balance = balances.getOrDefault(from, BigInteger.ZERO);
        if (balance.compareTo(cost) < 0) {
            throw new IllegalStateException("insufficient funds for gas * price + value: balance "
                    + balance + ", tx cost " + cost);
        }

        String to = key(tx.getTo());
        balances.put(from, balance.subtract(cost));
        balances.merge(to, tx.getValue(), BigInteger::add);
        nonces.put(from, expected.add(BigInteger.ONE));

        String txHash = Hash.sha3(signedTransactionHex);
        accepted.add(new AcceptedTransaction(txHash, from, to, tx.getNonce(), tx.getValue()));
        return txHash;
    }

    @Override
    public synchronized BigInteger getBalance(String account) {
        return balances.getOrDefault(key(account), BigInteger.ZERO);
    }

    @Override
    public long getChainId() {
        return chainId;
    }

    /**
     * 按受理顺序返回已上链的交易。
     */
    public synchronized List<AcceptedTransaction> getAcceptedTransactions() {
        return Collections.unmodifiableList(new ArrayList<>(accepted));
    }

    private static String key(String account) {
        String a = requireNonEmpty(account, "account").trim().toLowerCase(Locale.ROOT);
        return a.startsWith("0x") ? a : "0x" + a;
    }

    public static final class AcceptedTransaction {

        private final String txHash;
        private final String from;
        private final String to;
        private final BigInteger nonce;
        private final BigInteger value;

        AcceptedTransaction(String txHash, String from, String to, BigInteger nonce, BigInteger value) {
            this.txHash = txHash;
            this.from = from;
            this.to = to;
            this.nonce = nonce;
            this.value = value;
        }

        public String getTxHash() {
            return txHash;
        }

        public String getFrom() {
            return from;
        }

        public String getTo() {
            return to;
        }

        public BigInteger getNonce() {
            return nonce;
        }

        public BigInteger getValue() {
            return value;
        }
    }
}
