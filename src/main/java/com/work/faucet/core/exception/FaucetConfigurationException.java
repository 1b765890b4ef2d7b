package com.work.faucet.core.exception;

/**
 * 启动期配置错误：私钥缺失/非法、节点不可达、chainId 获取失败、金额或 cooldown 非法。
 * 该异常会使 Spring 容器启动失败。
 */
public class FaucetConfigurationException extends FaucetException {

    public FaucetConfigurationException(String message) {
        super(FaucetErrorCode.CONFIGURATION_INVALID, message);
    }

    public FaucetConfigurationException(FaucetErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
