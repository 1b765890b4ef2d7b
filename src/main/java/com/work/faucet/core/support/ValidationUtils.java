package com.work.faucet.core.support;

import com.work.faucet.core.exception.InvalidAddressException;
import org.web3j.crypto.Keys;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * EVM 地址：必须带 0x 前缀，后接 40 位十六进制。
     */
    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验Duration必须非负
     */
    public static Duration requireNonNegative(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative()) {
            throw new IllegalArgumentException(paramName + " 不能为负数");
        }
        return duration;
    }

    /**
     * 校验收款地址格式，返回去除首尾空白后的原始地址。
     * <p>约束：0x 前缀 + 40 位十六进制；大小写混合时必须满足 EIP-55 校验和。</p>
     *
     * @throws InvalidAddressException 地址非法
     */
    public static String requireValidAddress(String address) {
        if (address == null) {
            throw new InvalidAddressException("invalid Ethereum address");
        }
        String trimmed = address.trim();
        if (!ADDRESS_PATTERN.matcher(trimmed).matches()) {
            throw new InvalidAddressException("invalid Ethereum address");
        }
        String body = trimmed.substring(2);
        boolean allLower = body.equals(body.toLowerCase(Locale.ROOT));
        boolean allUpper = body.equals(body.toUpperCase(Locale.ROOT));
        if (!allLower && !allUpper && !Keys.toChecksumAddress(trimmed).equals(trimmed)) {
            throw new InvalidAddressException("invalid Ethereum address: checksum mismatch");
        }
        return trimmed;
    }

    /**
     * cooldown 表使用的规范化 key（小写）。
     */
    public static String normalizeAddress(String address) {
        return requireNonEmpty(address, "address").trim().toLowerCase(Locale.ROOT);
    }
}
