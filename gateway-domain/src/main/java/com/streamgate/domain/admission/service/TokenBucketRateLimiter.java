package com.streamgate.domain.admission.service;

import com.google.common.base.Preconditions;
import com.streamgate.domain.admission.model.entity.TokenBucket;
import com.streamgate.domain.admission.model.valobj.RateLimitDecision;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于令牌桶的按客户端限流器。
 * <p>
 * 每个客户端一个桶，首次访问时以满桶惰性创建。桶表由单把锁保护。
 * </p>
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    private static final long MIN_CLEANUP_INTERVAL_SECONDS = 60L;
    private static final int IDLE_CLEANUP_ROUNDS = 2;
    private static final double IDLE_FULLNESS_RATIO = 0.9D;

    @Getter
    private final int requestsPerWindow;
    @Getter
    private final long windowSeconds;
    @Getter
    private final double refillRate;
    @Getter
    private final long cleanupIntervalSeconds;
    private final Clock clock;

    private final Map<String, TokenBucket> buckets = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public TokenBucketRateLimiter(int requestsPerWindow, long windowSeconds, Clock clock) {
        Preconditions.checkArgument(requestsPerWindow > 0, "requestsPerWindow must be positive: %s", requestsPerWindow);
        Preconditions.checkArgument(windowSeconds > 0, "windowSeconds must be positive: %s", windowSeconds);
        this.requestsPerWindow = requestsPerWindow;
        this.windowSeconds = windowSeconds;
        this.refillRate = (double) requestsPerWindow / windowSeconds;
        this.cleanupIntervalSeconds = Math.max(MIN_CLEANUP_INTERVAL_SECONDS, windowSeconds);
        this.clock = Preconditions.checkNotNull(clock, "clock");
        log.info("RATE_LIMITER_INITIALIZED requestsPerWindow={}, windowSeconds={}, refillRate={}",
                requestsPerWindow, windowSeconds, refillRate);
    }

    @Override
    public RateLimitDecision allow(String clientId, double cost) {
        return allow(clientId, cost, requestsPerWindow);
    }

    /**
     * 以指定容量判定；桶容量与之不同时先按扩容补增量、缩容截断的规则调整。
     */
    public RateLimitDecision allow(String clientId, double cost, double capacity) {
        Preconditions.checkNotNull(clientId, "clientId");
        Preconditions.checkArgument(cost >= 0D, "cost must not be negative: %s", cost);
        Preconditions.checkArgument(capacity > 0D, "capacity must be positive: %s", capacity);
        Instant now = clock.instant();
        RateLimitDecision decision;
        lock.lock();
        try {
            TokenBucket bucket = buckets.computeIfAbsent(clientId, key -> newBucket(key, now));
            if (bucket.getCapacity() != capacity) {
                bucket.resize(capacity);
            }
            bucket.refill(now);
            if (bucket.tryConsume(cost)) {
                decision = RateLimitDecision.allow(bucket.getTokens());
            } else {
                decision = RateLimitDecision.deny(bucket.getTokens(), bucket.secondsUntil(cost));
            }
        } finally {
            lock.unlock();
        }
        if (decision.allowed()) {
            log.debug("RATE_LIMIT_ALLOWED clientId={}, cost={}, remainingTokens={}",
                    clientId, cost, decision.remainingTokens());
        } else {
            log.debug("RATE_LIMIT_DENIED clientId={}, cost={}, availableTokens={}, retryAfterSeconds={}",
                    clientId, cost, decision.remainingTokens(), decision.retryAfterSeconds());
        }
        return decision;
    }

    @Override
    public double remainingTokens(String clientId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            TokenBucket bucket = buckets.get(clientId);
            return bucket == null ? requestsPerWindow : bucket.projectedTokens(now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public double timeUntilNextToken(String clientId) {
        double tokens = remainingTokens(clientId);
        if (tokens >= 1D) {
            return 0D;
        }
        return (1D - tokens) / refillRate;
    }

    @Override
    public boolean reset(String clientId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            TokenBucket bucket = buckets.get(clientId);
            if (bucket == null) {
                return false;
            }
            bucket.reset(now);
        } finally {
            lock.unlock();
        }
        log.info("RATE_LIMIT_RESET clientId={}", clientId);
        return true;
    }

    @Override
    public Optional<Map<String, Object>> clientStats(String clientId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            TokenBucket bucket = buckets.get(clientId);
            if (bucket == null) {
                return Optional.empty();
            }
            double tokens = bucket.projectedTokens(now);
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("capacity", bucket.getCapacity());
            stats.put("currentTokens", tokens);
            stats.put("refillRate", refillRate);
            stats.put("utilization", bucket.utilization(tokens));
            stats.put("lastRefill", bucket.getLastRefill().toString());
            stats.put("lastAccess", bucket.getLastAccess().toString());
            return Optional.of(stats);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Object> stats() {
        Instant now = clock.instant();
        Map<String, Object> clients = new LinkedHashMap<>();
        int totalClients;
        lock.lock();
        try {
            totalClients = buckets.size();
            for (Map.Entry<String, TokenBucket> entry : buckets.entrySet()) {
                TokenBucket bucket = entry.getValue();
                double tokens = bucket.projectedTokens(now);
                Map<String, Object> client = new LinkedHashMap<>();
                client.put("capacity", bucket.getCapacity());
                client.put("currentTokens", tokens);
                client.put("utilization", bucket.utilization(tokens));
                client.put("lastRefill", bucket.getLastRefill().toString());
                clients.put(entry.getKey(), client);
            }
        } finally {
            lock.unlock();
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalClients", totalClients);
        stats.put("requestsPerWindow", requestsPerWindow);
        stats.put("windowSeconds", windowSeconds);
        stats.put("refillRate", refillRate);
        stats.put("clients", clients);
        return stats;
    }

    @Override
    public int cleanupInactive() {
        Instant now = clock.instant();
        Duration idleThreshold = Duration.ofSeconds(cleanupIntervalSeconds * IDLE_CLEANUP_ROUNDS);
        List<String> removed = new ArrayList<>();
        int remaining;
        lock.lock();
        try {
            buckets.entrySet().removeIf(entry -> {
                if (entry.getValue().isIdle(now, idleThreshold, IDLE_FULLNESS_RATIO)) {
                    removed.add(entry.getKey());
                    return true;
                }
                return false;
            });
            remaining = buckets.size();
        } finally {
            lock.unlock();
        }
        if (!removed.isEmpty()) {
            log.info("RATE_LIMIT_BUCKETS_CLEANED count={}, remainingClients={}", removed.size(), remaining);
        }
        return removed.size();
    }

    public int trackedClients() {
        lock.lock();
        try {
            return buckets.size();
        } finally {
            lock.unlock();
        }
    }

    private TokenBucket newBucket(String clientId, Instant now) {
        log.debug("RATE_LIMIT_BUCKET_CREATED clientId={}, capacity={}", clientId, requestsPerWindow);
        return new TokenBucket(requestsPerWindow, refillRate, now);
    }

}
