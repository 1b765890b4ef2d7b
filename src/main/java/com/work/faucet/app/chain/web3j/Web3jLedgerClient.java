package com.work.faucet.app.chain.web3j;

import com.work.faucet.core.chain.LedgerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetBalance;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;

import java.io.IOException;
import java.math.BigInteger;

/**
 * 基于 Web3j 的节点客户端实现：
 * - eth_getTransactionCount(pending) 查询 nonce
 * - eth_gasPrice / eth_estimateGas 获取 gas 参数
 * - eth_sendRawTransaction 提交已签名交易
 * - eth_getBalance / eth_chainId
 *
 * 节点返回的 JSON-RPC error 统一转换为异常，由 core 按调用类型归类。
 */
public class Web3jLedgerClient implements LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerClient.class);

    private final Web3j web3j;

    public Web3jLedgerClient(Web3j web3j) {
        this.web3j = web3j;
    }

    @Override
    public BigInteger getPendingNonce(String account) {
        EthGetTransactionCount resp = send("eth_getTransactionCount",
                web3j.ethGetTransactionCount(account, DefaultBlockParameterName.PENDING));
        return resp.getTransactionCount();
    }

    @Override
    public BigInteger suggestGasPrice() {
        EthGasPrice resp = send("eth_gasPrice", web3j.ethGasPrice());
        return resp.getGasPrice();
    }

    @Override
    public BigInteger estimateGas(String from, String to, BigInteger value) {
        Transaction call = Transaction.createEtherTransaction(from, null, null, null, to, value);
        EthEstimateGas resp = send("eth_estimateGas", web3j.ethEstimateGas(call));
        return resp.getAmountUsed();
    }

    @Override
    public String submitTransaction(String signedTransactionHex) {
        EthSendTransaction resp = send("eth_sendRawTransaction", web3j.ethSendRawTransaction(signedTransactionHex));
        return resp.getTransactionHash();
    }

    @Override
    public BigInteger getBalance(String account) {
        EthGetBalance resp = send("eth_getBalance", web3j.ethGetBalance(account, DefaultBlockParameterName.LATEST));
        return resp.getBalance();
    }

    @Override
    public long getChainId() {
        EthChainId resp = send("eth_chainId", web3j.ethChainId());
        return resp.getChainId().longValueExact();
    }

    private <T extends Response<?>> T send(String method, Request<?, T> request) {
        T resp;
        try {
            resp = request.send();
        } catch (IOException e) {
            log.warn("Web3j {} failed. err={}", method, e.getMessage());
            throw new RuntimeException(method + ": " + e.getMessage(), e);
        }
        if (resp.hasError()) {
            Response.Error error = resp.getError();
            log.warn("Web3j {} rejected. code={} message={}", method, error.getCode(), error.getMessage());
            throw new IllegalStateException(error.getMessage());
        }
        return resp;
    }
}
