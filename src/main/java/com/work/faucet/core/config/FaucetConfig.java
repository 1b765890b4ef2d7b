package com.work.faucet.core.config;

import com.work.faucet.core.exception.FaucetConfigurationException;

import java.math.BigInteger;
import java.time.Duration;

import static com.work.faucet.core.support.ValidationUtils.requireNonNegative;
import static com.work.faucet.core.support.ValidationUtils.requireNonNull;
import static com.work.faucet.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class FaucetConfig {

    private final BigInteger amount;
    private final Duration cooldown;
    private final int retentionMultiplier;
    private final Duration retention;
    private final Duration pipelineWaitTimeout;

    public FaucetConfig(BigInteger amount,
                        Duration cooldown,
                        int retentionMultiplier,
                        Duration pipelineWaitTimeout) {
        requireNonNull(amount, "amount");
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("amount 必须大于0");
        }
        this.amount = amount;
        this.cooldown = requireNonNegative(cooldown, "cooldown");
        this.retentionMultiplier = Math.max(1, retentionMultiplier);
        try {
            this.retention = this.cooldown.multipliedBy(this.retentionMultiplier);
        } catch (ArithmeticException e) {
            throw new FaucetConfigurationException("invalid COOLDOWN_HOURS: " + cooldown.toHours()
                    + " hours is too large for retention multiplier " + this.retentionMultiplier);
        }
        this.pipelineWaitTimeout = requirePositive(pipelineWaitTimeout, "pipelineWaitTimeout");
    }

    /**
     * 解析十进制 wei 金额；非法时抛出启动期致命异常。
     */
    public static BigInteger parseAmount(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new FaucetConfigurationException("invalid FAUCET_AMOUNT: value is empty");
        }
        BigInteger amount;
        try {
            amount = new BigInteger(raw.trim(), 10);
        } catch (NumberFormatException e) {
            throw new FaucetConfigurationException("invalid FAUCET_AMOUNT: " + raw);
        }
        if (amount.signum() <= 0) {
            throw new FaucetConfigurationException("invalid FAUCET_AMOUNT: must be positive");
        }
        return amount;
    }

    /**
     * 解析整数小时数；非法时抛出启动期致命异常。
     */
    public static Duration parseCooldownHours(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new FaucetConfigurationException("invalid COOLDOWN_HOURS: value is empty");
        }
        long hours;
        try {
            hours = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new FaucetConfigurationException("invalid COOLDOWN_HOURS: " + raw);
        }
        if (hours < 0) {
            throw new FaucetConfigurationException("invalid COOLDOWN_HOURS: must not be negative");
        }
        try {
            return Duration.ofHours(hours);
        } catch (ArithmeticException e) {
            throw new FaucetConfigurationException("invalid COOLDOWN_HOURS: " + raw.trim() + " is too large");
        }
    }

    public BigInteger getAmount() {
        return amount;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public int getRetentionMultiplier() {
        return retentionMultiplier;
    }

    /**
     * cooldown 记录的保留时长，始终不小于 cooldown 本身。
     */
    public Duration getRetention() {
        return retention;
    }

    public Duration getPipelineWaitTimeout() {
        return pipelineWaitTimeout;
    }
}
