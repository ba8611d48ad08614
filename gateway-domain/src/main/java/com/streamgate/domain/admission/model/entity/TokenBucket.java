package com.streamgate.domain.admission.model.entity;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * 单个客户端的令牌桶。
 * <p>
 * 非线程安全，由所属限流器的锁保护。容量使用 double，便于自适应倍数精确生效；
 * 始终满足 {@code 0 <= tokens <= capacity}。
 * </p>
 */
@Getter
public class TokenBucket {

    /** 浮点比较容差，避免 12s * (5/60) 这类补充因舍入差一点凑不满一个令牌 */
    private static final double EPSILON = 1e-9D;

    private double capacity;
    private double tokens;
    private final double refillRate;
    private Instant lastRefill;
    private Instant lastAccess;

    public TokenBucket(double capacity, double refillRate, Instant now) {
        this.capacity = capacity;
        this.tokens = capacity;
        this.refillRate = refillRate;
        this.lastRefill = now;
        this.lastAccess = now;
    }

    /**
     * 按流逝时间补充令牌并记录访问时间；时钟回拨时不补充。
     */
    public void refill(Instant now) {
        if (now.isAfter(lastAccess)) {
            lastAccess = now;
        }
        double elapsed = secondsBetween(lastRefill, now);
        if (elapsed <= 0D) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsed * refillRate);
        lastRefill = now;
    }

    /**
     * 尝试扣减令牌。cost 为 0 时恒放行且不改变令牌数。
     */
    public boolean tryConsume(double cost) {
        if (cost == 0D) {
            return true;
        }
        if (tokens + EPSILON >= cost) {
            tokens = Math.max(0D, tokens - cost);
            return true;
        }
        return false;
    }

    /**
     * 不修改状态地计算 now 时刻的令牌数，用于统计与清理。
     */
    public double projectedTokens(Instant now) {
        double elapsed = Math.max(0D, secondsBetween(lastRefill, now));
        return Math.min(capacity, tokens + elapsed * refillRate);
    }

    /**
     * 调整容量：扩容时令牌按增量补充（不超过新容量），缩容时令牌截断到新容量。
     */
    public void resize(double newCapacity) {
        if (newCapacity > capacity) {
            tokens = Math.min(newCapacity, tokens + (newCapacity - capacity));
        } else {
            tokens = Math.min(tokens, newCapacity);
        }
        capacity = newCapacity;
    }

    public void reset(Instant now) {
        tokens = capacity;
        lastRefill = now;
        lastAccess = now;
    }

    public double utilization(double currentTokens) {
        if (capacity <= 0D) {
            return 0D;
        }
        return (capacity - currentTokens) / capacity;
    }

    /**
     * 距离凑够 cost 个令牌还需等待的秒数。
     */
    public double secondsUntil(double cost) {
        if (tokens + EPSILON >= cost) {
            return 0D;
        }
        return (cost - tokens) / refillRate;
    }

    public boolean isIdle(Instant now, Duration idleThreshold, double fullnessRatio) {
        boolean nearlyFull = projectedTokens(now) + EPSILON >= capacity * fullnessRatio;
        return nearlyFull && lastAccess.isBefore(now.minus(idleThreshold));
    }

    private static double secondsBetween(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / 1_000_000_000D;
    }

}
