package com.work.faucet.app.service;

import com.work.faucet.core.BalanceInspector;
import com.work.faucet.core.chain.ChainIdentity;
import com.work.faucet.core.config.FaucetConfig;
import com.work.faucet.core.exception.LedgerQueryException;
import com.work.faucet.core.signer.FaucetAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 启动后输出出账账户信息与余额。余额查询失败不影响服务启动（余额未校验状态）。
 */
@Component
public class FaucetStartupReporter implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(FaucetStartupReporter.class);

    private final FaucetAccount account;
    private final ChainIdentity chainIdentity;
    private final FaucetConfig config;
    private final BalanceInspector balanceInspector;

    public FaucetStartupReporter(FaucetAccount account,
                                 ChainIdentity chainIdentity,
                                 FaucetConfig config,
                                 BalanceInspector balanceInspector) {
        this.account = account;
        this.chainIdentity = chainIdentity;
        this.config = config;
        this.balanceInspector = balanceInspector;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Faucet address: {} chainId={} amount={} wei cooldown={}",
                account.getChecksumAddress(), chainIdentity.getChainId(), config.getAmount(), config.getCooldown());
        try {
            BigInteger balance = balanceInspector.getBalance();
            BigDecimal ether = Convert.fromWei(new BigDecimal(balance), Convert.Unit.ETHER);
            log.info("Faucet balance: {} ETH ({} wei)", ether.toPlainString(), balance);
            if (balance.compareTo(config.getAmount()) < 0) {
                log.warn("Faucet balance is below one disbursement amount, requests will fail until funded");
            }
        } catch (LedgerQueryException e) {
            log.warn("Warning: failed to get balance: {}", e.getMessage());
        }
    }
}
