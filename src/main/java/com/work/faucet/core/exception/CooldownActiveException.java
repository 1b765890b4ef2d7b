package com.work.faucet.core.exception;

import java.time.Duration;

/**
 * 地址仍处于 cooldown 窗口内。
 */
public class CooldownActiveException extends FaucetException {

    private final String address;
    private final Duration remaining;

    public CooldownActiveException(String address, Duration remaining, String message) {
        super(FaucetErrorCode.COOLDOWN_ACTIVE, message);
        this.address = address;
        this.remaining = remaining;
    }

    public String getAddress() {
        return address;
    }

    /**
     * 精确的剩余等待时间（未取整）。
     */
    public Duration getRemaining() {
        return remaining;
    }
}
