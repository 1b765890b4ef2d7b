package com.work.faucet.core.chain;

import java.math.BigInteger;

/**
 * 链上节点的最小端口。core 只依赖该契约，不关心具体 RPC 实现。
 *
 * 所有方法均为阻塞调用，失败时抛出非受检异常；超时由 {@link LedgerCallExecutor} 统一控制。
 */
public interface LedgerClient {

    /**
     * 查询 pending nonce（EVM: eth_getTransactionCount(pending)）。
     */
    BigInteger getPendingNonce(String account);

    /**
     * 节点建议的 gasPrice（wei）。
     */
    BigInteger suggestGasPrice();

    /**
     * 为 from -> to 的 value 转账估算 gas。
     */
    BigInteger estimateGas(String from, String to, BigInteger value);

    /**
     * 提交已签名交易（0x 前缀的十六进制 RLP），返回节点给出的 txHash。
     * 实现方不保证幂等。
     */
    String submitTransaction(String signedTransactionHex);

    /**
     * 查询账户最新余额（wei）。
     */
    BigInteger getBalance(String account);

    /**
     * 查询 chainId（EIP-155）。
     */
    long getChainId();
}
