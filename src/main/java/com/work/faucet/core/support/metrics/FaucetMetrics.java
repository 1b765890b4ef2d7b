package com.work.faucet.core.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；业务/平台可通过自定义 Bean 接入具体实现。
 */
public interface FaucetMetrics {

    /**
     * 一次请求的最终结果：success 或错误码名称。
     */
    default void disbursement(String result) {
    }

    default void ledgerCall(String operation, long elapsedMillis) {
    }

    default void pipelineQueueDepth(int depth) {
    }

    default void cooldownEntries(long size) {
    }
}
