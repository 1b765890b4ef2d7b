package com.work.faucet.core.model;

/**
 * 已签名交易：RLP 十六进制与本地计算的 txHash。
 */
public final class SignedTransfer {

    private final PendingTransfer transfer;
    private final String rawHex;
    private final String txHash;

    public SignedTransfer(PendingTransfer transfer, String rawHex, String txHash) {
        this.transfer = transfer;
        this.rawHex = rawHex;
        this.txHash = txHash;
    }

    public PendingTransfer getTransfer() {
        return transfer;
    }

    public String getRawHex() {
        return rawHex;
    }

    public String getTxHash() {
        return txHash;
    }
}
