package com.work.faucet.app.service;

import com.work.faucet.core.cooldown.CooldownTable;
import com.work.faucet.core.support.metrics.FaucetMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期淘汰超过保留期的 cooldown 记录，控制内存占用。
 */
@Component
public class CooldownCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(CooldownCleanupJob.class);

    private final CooldownTable cooldownTable;
    private final FaucetMetrics metrics;

    public CooldownCleanupJob(CooldownTable cooldownTable, FaucetMetrics metrics) {
        this.cooldownTable = cooldownTable;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${faucet.cooldown-cleanup-interval-ms:600000}")
    public void runOnce() {
        long remaining = cooldownTable.cleanUp();
        metrics.cooldownEntries(remaining);
        log.debug("cooldown cleanup done, tracked addresses={}", remaining);
    }
}
