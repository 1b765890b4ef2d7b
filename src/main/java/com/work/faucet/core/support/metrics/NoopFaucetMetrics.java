package com.work.faucet.core.support.metrics;

/**
 * 默认 no-op 实现：保证工程在不引入任何 metrics 依赖时仍可运行。
 *
 * 若业务侧提供了自定义 FaucetMetrics Bean，将通过 @ConditionalOnMissingBean 覆盖本实现。
 */
public class NoopFaucetMetrics implements FaucetMetrics {
}
