package com.work.faucet.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 仅存在于宿主侧，用于从 application.yml / 环境变量读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.faucet.core.config.FaucetConfig}。
 *
 * amount / cooldownHours 保留为字符串，由 core 解析，以便给出明确的启动错误。
 */
@Validated
@ConfigurationProperties(prefix = "faucet")
public class FaucetProperties {

    /**
     * 64 位十六进制私钥，不带 0x 前缀（必填）
     */
    private String privateKey;

    /**
     * 每次发放的金额（wei）
     */
    private String amount = "1000000000000000000";

    /**
     * 同一地址两次领取之间的最小间隔（小时）
     */
    private String cooldownHours = "24";

    /**
     * cooldown 记录保留时长 = cooldown * retentionMultiplier
     */
    @Min(1)
    private int retentionMultiplier = 2;

    /**
     * 等待进入提交流水线的最长时间
     */
    @NotNull
    private Duration pipelineWaitTimeout = Duration.ofSeconds(60);

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public String getAmount() {
        return amount;
    }

    public void setAmount(String amount) {
        this.amount = amount;
    }

    public String getCooldownHours() {
        return cooldownHours;
    }

    public void setCooldownHours(String cooldownHours) {
        this.cooldownHours = cooldownHours;
    }

    public int getRetentionMultiplier() {
        return retentionMultiplier;
    }

    public void setRetentionMultiplier(int retentionMultiplier) {
        this.retentionMultiplier = retentionMultiplier;
    }

    public Duration getPipelineWaitTimeout() {
        return pipelineWaitTimeout;
    }

    public void setPipelineWaitTimeout(Duration pipelineWaitTimeout) {
        this.pipelineWaitTimeout = pipelineWaitTimeout;
    }

    @Override
    public String toString() {
        return "FaucetProperties{amount=" + amount + ", cooldownHours=" + cooldownHours
                + ", retentionMultiplier=" + retentionMultiplier
                + ", pipelineWaitTimeout=" + pipelineWaitTimeout + "}";
    }
}
