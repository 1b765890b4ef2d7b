package com.work.faucet.core.cooldown;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.faucet.core.exception.CooldownActiveException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.work.faucet.core.support.ValidationUtils.normalizeAddress;
import static com.work.faucet.core.support.ValidationUtils.requireNonNegative;
import static com.work.faucet.core.support.ValidationUtils.requireNonNull;

/**
 * 地址 -> 最近一次成功出账时间。
 * <p>
 * 约束：
 * - 读（资格判断）可并发，写（记录出账）独占
 * - 只在交易被节点受理之后写入
 * - 记录保留 {@code retention}（不小于 cooldown）后由 Caffeine 淘汰，已淘汰的地址必然已过 cooldown
 * - 没有容量上限，记录数受 cooldown 窗口内的出账次数约束
 * - 仅存在于内存，进程重启后全部丢失
 */
public class CooldownTable {

    private final Duration cooldown;
    private final Clock clock;
    private final Cache<String, Instant> lastDisbursed;
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final Lock readLock = rw.readLock();
    private final Lock writeLock = rw.writeLock();

    public CooldownTable(Duration cooldown, Duration retention, Clock clock) {
        this.cooldown = requireNonNegative(cooldown, "cooldown");
        this.clock = requireNonNull(clock, "clock");
        requireNonNegative(retention, "retention");
        Duration keep = retention.compareTo(cooldown) < 0 ? cooldown : retention;
        // 只按写入时间淘汰：不设容量上限，容量淘汰会丢掉仍在 cooldown 内的记录
        this.lastDisbursed = Caffeine.newBuilder()
                .expireAfterWrite(saturatedNanos(keep), TimeUnit.NANOSECONDS)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * 剩余等待时间；不在 cooldown 内时返回 empty。
     */
    public Optional<Duration> remaining(String address) {
        String key = normalizeAddress(address);
        Instant last;
        readLock.lock();
        try {
            last = lastDisbursed.getIfPresent(key);
        } finally {
            readLock.unlock();
        }
        if (last == null) {
            return Optional.empty();
        }
        Duration elapsed = Duration.between(last, clock.instant());
        if (elapsed.compareTo(cooldown) >= 0) {
            return Optional.empty();
        }
        return Optional.of(cooldown.minus(elapsed));
    }

    /**
     * @throws CooldownActiveException 地址仍在 cooldown 内
     */
    public void requireEligible(String address) {
        Optional<Duration> left = remaining(address);
        if (left.isPresent()) {
            throw new CooldownActiveException(address, left.get(),
                    "address " + address + " can request again in " + formatRoundedMinutes(left.get()));
        }
    }

    /**
     * 记录一次成功出账。
     */
    public void record(String address, Instant at) {
        String key = normalizeAddress(address);
        requireNonNull(at, "at");
        writeLock.lock();
        try {
            lastDisbursed.put(key, at);
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<Instant> lastDisbursedAt(String address) {
        String key = normalizeAddress(address);
        readLock.lock();
        try {
            return Optional.ofNullable(lastDisbursed.getIfPresent(key));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 主动触发过期淘汰，返回淘汰后的记录数。
     */
    public long cleanUp() {
        writeLock.lock();
        try {
            lastDisbursed.cleanUp();
            return lastDisbursed.estimatedSize();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 四舍五入到分钟（半分钟进位），形如 30m、1h5m、0m。
     */
    public static String formatRoundedMinutes(Duration remaining) {
        long seconds = remaining.getSeconds();
        long minutes = seconds / 60 + (seconds % 60 >= 30 ? 1 : 0);
        long hours = minutes / 60;
        long rest = minutes % 60;
        return hours > 0 ? hours + "h" + rest + "m" : rest + "m";
    }

    private static long saturatedNanos(Duration d) {
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
