package com.work.faucet.app.config;

import com.work.faucet.app.chain.web3j.Web3jLedgerClient;
import com.work.faucet.core.chain.LedgerClient;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 或未配置时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j", matchIfMissing = true)
public class Web3jConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        OkHttpClient http = new OkHttpClient.Builder()
                .callTimeout(properties.getRequestTimeout())
                .build();
        return Web3j.build(new HttpService(properties.getRpcUrl(), http));
    }

    @Bean
    public LedgerClient web3jLedgerClient(Web3j web3j) {
        return new Web3jLedgerClient(web3j);
    }
}
