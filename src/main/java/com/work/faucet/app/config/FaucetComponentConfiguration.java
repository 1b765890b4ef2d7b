package com.work.faucet.app.config;

import com.work.faucet.core.BalanceInspector;
import com.work.faucet.core.DisbursementEngine;
import com.work.faucet.core.chain.ChainIdentity;
import com.work.faucet.core.chain.LedgerCallExecutor;
import com.work.faucet.core.chain.LedgerClient;
import com.work.faucet.core.chain.LedgerOperation;
import com.work.faucet.core.config.FaucetConfig;
import com.work.faucet.core.cooldown.CooldownTable;
import com.work.faucet.core.exception.FaucetConfigurationException;
import com.work.faucet.core.execution.SubmitPipeline;
import com.work.faucet.core.signer.FaucetAccount;
import com.work.faucet.core.signer.TransferSigner;
import com.work.faucet.core.support.InMemoryLedgerClient;
import com.work.faucet.core.support.metrics.FaucetMetrics;
import com.work.faucet.core.support.metrics.NoopFaucetMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 将核心组件装配为 Spring Bean。
 * 任一启动期校验失败（私钥、金额、cooldown、节点连接、chainId）都会让容器启动失败。
 */
@Configuration
@EnableConfigurationProperties({FaucetProperties.class, ChainProperties.class})
public class FaucetComponentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FaucetComponentConfiguration.class);

    /**
     * 仅在显式设置 chain.mode=mock 时使用内存账本，默认由 Web3jConfiguration 连接节点
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock")
    public LedgerClient inMemoryLedgerClient(ChainProperties chain, FaucetAccount account) {
        log.warn("chain.mode=mock: using in-memory ledger, no real transactions will be sent");
        InMemoryLedgerClient ledger = new InMemoryLedgerClient(chain.getMockChainId());
        ledger.credit(account.getAddress(), chain.getMockInitialBalance());
        return ledger;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock faucetClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(FaucetMetrics.class)
    public FaucetMetrics faucetMetrics() {
        return new NoopFaucetMetrics();
    }

    @Bean
    public FaucetConfig faucetConfig(FaucetProperties properties) {
        return new FaucetConfig(
                FaucetConfig.parseAmount(properties.getAmount()),
                FaucetConfig.parseCooldownHours(properties.getCooldownHours()),
                properties.getRetentionMultiplier(),
                properties.getPipelineWaitTimeout()
        );
    }

    @Bean
    public FaucetAccount faucetAccount(FaucetProperties properties) {
        return FaucetAccount.fromPrivateKeyHex(properties.getPrivateKey());
    }

    @Bean(destroyMethod = "close")
    public LedgerCallExecutor ledgerCallExecutor(ChainProperties chain) {
        return new LedgerCallExecutor(chain.getRequestTimeout());
    }

    @Bean
    public ChainIdentity chainIdentity(LedgerClient ledger, LedgerCallExecutor calls) {
        Long chainId = calls.call(LedgerOperation.CHAIN_ID, ledger::getChainId);
        try {
            return new ChainIdentity(chainId);
        } catch (IllegalArgumentException e) {
            throw new FaucetConfigurationException(LedgerOperation.CHAIN_ID.getErrorCode(),
                    "failed to get chain ID: node returned " + chainId, e);
        }
    }

    @Bean
    public TransferSigner transferSigner(FaucetAccount account, ChainIdentity chainIdentity) {
        return new TransferSigner(account, chainIdentity);
    }

    @Bean
    public CooldownTable cooldownTable(FaucetConfig config, Clock clock) {
        return new CooldownTable(config.getCooldown(), config.getRetention(), clock);
    }

    @Bean
    public SubmitPipeline submitPipeline(FaucetConfig config) {
        return new SubmitPipeline(config.getPipelineWaitTimeout());
    }

    @Bean
    public DisbursementEngine disbursementEngine(LedgerClient ledger,
                                                 LedgerCallExecutor calls,
                                                 TransferSigner signer,
                                                 CooldownTable cooldownTable,
                                                 SubmitPipeline pipeline,
                                                 FaucetConfig config,
                                                 FaucetMetrics metrics) {
        return new DisbursementEngine(ledger, calls, signer, cooldownTable, pipeline, config.getAmount(), metrics);
    }

    @Bean
    public BalanceInspector balanceInspector(LedgerClient ledger, LedgerCallExecutor calls, FaucetAccount account) {
        return new BalanceInspector(ledger, calls, account);
    }
}
