package com.work.faucet.core.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * 一次成功出账的结果。
 */
public final class Disbursement {

    private final String txHash;
    private final String recipient;
    private final BigInteger nonce;
    private final BigInteger amount;
    private final Instant disbursedAt;

    public Disbursement(String txHash, String recipient, BigInteger nonce, BigInteger amount, Instant disbursedAt) {
        this.txHash = txHash;
        this.recipient = recipient;
        this.nonce = nonce;
        this.amount = amount;
        this.disbursedAt = disbursedAt;
    }

    public String getTxHash() {
        return txHash;
    }

    public String getRecipient() {
        return recipient;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public Instant getDisbursedAt() {
        return disbursedAt;
    }
}
