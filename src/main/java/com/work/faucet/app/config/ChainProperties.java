package com.work.faucet.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 链连接配置。
 *
 * mode=web3j（默认）: 使用 Web3jLedgerClient 连接 rpcUrl
 * mode=mock: 使用 InMemoryLedgerClient，仅用于本地演示与测试
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * web3j 或 mock
     */
    private String mode = "web3j";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * 单次 RPC 调用的超时（每次调用独立计时，同时作用于 HTTP 客户端）
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    /**
     * mock 模式下的 chainId
     */
    private long mockChainId = 1337L;

    /**
     * mock 模式下出账账户的初始余额（wei）
     */
    private BigInteger mockInitialBalance = new BigInteger("100000000000000000000");

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public long getMockChainId() {
        return mockChainId;
    }

    public void setMockChainId(long mockChainId) {
        this.mockChainId = mockChainId;
    }

    public BigInteger getMockInitialBalance() {
        return mockInitialBalance;
    }

    public void setMockInitialBalance(BigInteger mockInitialBalance) {
        this.mockInitialBalance = mockInitialBalance;
    }
}
