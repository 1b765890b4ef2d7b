package com.work.faucet.core.model;

import org.web3j.crypto.RawTransaction;

import java.math.BigInteger;

import static com.work.faucet.core.support.ValidationUtils.requireNonEmpty;
import static com.work.faucet.core.support.ValidationUtils.requireNonNull;

/**
 * 待签名的原生资产转账，只在一次请求的签名与提交之间存在。
 */
public final class PendingTransfer {

    private final BigInteger nonce;
    private final String to;
    private final BigInteger value;
    private final BigInteger gasPrice;
    private final BigInteger gasLimit;
    private final long chainId;

    public PendingTransfer(BigInteger nonce,
                           String to,
                           BigInteger value,
                           BigInteger gasPrice,
                           BigInteger gasLimit,
                           long chainId) {
        this.nonce = requireNonNull(nonce, "nonce");
        this.to = requireNonEmpty(to, "to");
        this.value = requireNonNull(value, "value");
        this.gasPrice = requireNonNull(gasPrice, "gasPrice");
        this.gasLimit = requireNonNull(gasLimit, "gasLimit");
        this.chainId = chainId;
    }

    public RawTransaction toRawTransaction() {
        return RawTransaction.createEtherTransaction(nonce, gasPrice, gasLimit, to, value);
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public String getTo() {
        return to;
    }

    public BigInteger getValue() {
        return value;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public long getChainId() {
        return chainId;
    }

    @Override
    public String toString() {
        return "PendingTransfer{nonce=" + nonce + ", to=" + to + ", value=" + value
                + ", gasPrice=" + gasPrice + ", gasLimit=" + gasLimit + ", chainId=" + chainId + "}";
    }
}
