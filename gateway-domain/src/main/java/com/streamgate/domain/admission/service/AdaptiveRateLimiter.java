package com.streamgate.domain.admission.service;

import com.google.common.base.Preconditions;
import com.streamgate.domain.admission.model.valobj.RateLimitDecision;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 自适应限流装饰器。
 * <p>
 * 对每个客户端维护成功率与请求间隔的指数移动平均（新样本权重 0.1，初值均为 1.0），
 * 每次判定前计算倍数
 * {@code clamp(successRate * min(2.0, avgInterval / (window / capacity)), min, max)}，
 * 以 {@code baseCapacity * multiplier} 作为本次有效容量交给基础限流器。
 * 行为表有独立的锁，调用基础限流器前释放。
 * </p>
 */
@Slf4j
public class AdaptiveRateLimiter implements RateLimiter {

    private static final double EWMA_WEIGHT = 0.1D;
    private static final double MAX_INTERVAL_FACTOR = 2.0D;
    private static final double INITIAL_SUCCESS_RATE = 1.0D;
    private static final double INITIAL_AVG_INTERVAL_SECONDS = 1.0D;
    private static final int IDLE_CLEANUP_ROUNDS = 2;

    private final TokenBucketRateLimiter delegate;
    @Getter
    private final double minMultiplier;
    @Getter
    private final double maxMultiplier;
    private final Clock clock;

    private final Map<String, ClientBehavior> behaviors = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public AdaptiveRateLimiter(TokenBucketRateLimiter delegate, double minMultiplier, double maxMultiplier, Clock clock) {
        this.delegate = Preconditions.checkNotNull(delegate, "delegate");
        Preconditions.checkArgument(minMultiplier > 0D, "minMultiplier must be positive: %s", minMultiplier);
        Preconditions.checkArgument(maxMultiplier >= minMultiplier,
                "maxMultiplier %s must not be less than minMultiplier %s", maxMultiplier, minMultiplier);
        this.minMultiplier = minMultiplier;
        this.maxMultiplier = maxMultiplier;
        this.clock = Preconditions.checkNotNull(clock, "clock");
        log.info("ADAPTIVE_RATE_LIMITER_INITIALIZED baseCapacity={}, minMultiplier={}, maxMultiplier={}",
                delegate.getRequestsPerWindow(), minMultiplier, maxMultiplier);
    }

    @Override
    public RateLimitDecision allow(String clientId, double cost) {
        Preconditions.checkNotNull(clientId, "clientId");
        Preconditions.checkArgument(cost >= 0D, "cost must not be negative: %s", cost);
        Instant now = clock.instant();
        double multiplier;
        lock.lock();
        try {
            ClientBehavior behavior = behaviors.computeIfAbsent(clientId, key -> new ClientBehavior());
            behavior.observeRequest(now);
            multiplier = multiplierOf(behavior);
        } finally {
            lock.unlock();
        }
        double capacity = effectiveCapacity(multiplier, cost);
        RateLimitDecision decision = delegate.allow(clientId, cost, capacity);
        log.debug("ADAPTIVE_RATE_LIMIT_APPLIED clientId={}, multiplier={}, capacity={}, allowed={}",
                clientId, multiplier, capacity, decision.allowed());
        return decision;
    }

    @Override
    public void recordResult(String clientId, boolean success) {
        if (clientId == null) {
            return;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            behaviors.computeIfAbsent(clientId, key -> new ClientBehavior()).observeResult(success, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前倍数；未知客户端按初始行为计算。
     */
    public double currentMultiplier(String clientId) {
        lock.lock();
        try {
            ClientBehavior behavior = behaviors.get(clientId);
            return multiplierOf(behavior == null ? new ClientBehavior() : behavior);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public double remainingTokens(String clientId) {
        return delegate.remainingTokens(clientId);
    }

    @Override
    public double timeUntilNextToken(String clientId) {
        return delegate.timeUntilNextToken(clientId);
    }

    @Override
    public boolean reset(String clientId) {
        return delegate.reset(clientId);
    }

    @Override
    public Optional<Map<String, Object>> clientStats(String clientId) {
        Optional<Map<String, Object>> base = delegate.clientStats(clientId);
        if (base.isEmpty()) {
            return base;
        }
        Map<String, Object> stats = base.get();
        lock.lock();
        try {
            appendBehavior(stats, behaviors.get(clientId));
        } finally {
            lock.unlock();
        }
        return Optional.of(stats);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> stats() {
        Map<String, Object> stats = delegate.stats();
        Map<String, Object> clients = (Map<String, Object>) stats.get("clients");
        lock.lock();
        try {
            for (Map.Entry<String, Object> entry : clients.entrySet()) {
                appendBehavior((Map<String, Object>) entry.getValue(), behaviors.get(entry.getKey()));
            }
            Map<String, Object> adaptive = new LinkedHashMap<>();
            adaptive.put("minMultiplier", minMultiplier);
            adaptive.put("maxMultiplier", maxMultiplier);
            adaptive.put("trackedBehaviors", behaviors.size());
            stats.put("adaptive", adaptive);
        } finally {
            lock.unlock();
        }
        return stats;
    }

    @Override
    public int cleanupInactive() {
        int removedBuckets = delegate.cleanupInactive();
        Instant threshold = clock.instant()
                .minus(Duration.ofSeconds(delegate.getCleanupIntervalSeconds() * IDLE_CLEANUP_ROUNDS));
        int removedBehaviors;
        lock.lock();
        try {
            int before = behaviors.size();
            behaviors.values().removeIf(behavior -> behavior.getLastSeen().isBefore(threshold));
            removedBehaviors = before - behaviors.size();
        } finally {
            lock.unlock();
        }
        if (removedBehaviors > 0) {
            log.info("ADAPTIVE_BEHAVIORS_CLEANED count={}", removedBehaviors);
        }
        return removedBuckets;
    }

    @Override
    public long getCleanupIntervalSeconds() {
        return delegate.getCleanupIntervalSeconds();
    }

    private double multiplierOf(ClientBehavior behavior) {
        double baseInterval = (double) delegate.getWindowSeconds() / delegate.getRequestsPerWindow();
        double intervalFactor = Math.min(MAX_INTERVAL_FACTOR, behavior.getAvgInterval() / baseInterval);
        double multiplier = behavior.getSuccessRate() * intervalFactor;
        return Math.max(minMultiplier, Math.min(maxMultiplier, multiplier));
    }

    /**
     * 倍数作用后的容量，至少容得下一次请求，否则小配额客户端会被永久拒绝。
     */
    private double effectiveCapacity(double multiplier, double cost) {
        return Math.max(Math.max(1D, cost), delegate.getRequestsPerWindow() * multiplier);
    }

    private void appendBehavior(Map<String, Object> target, ClientBehavior behavior) {
        ClientBehavior effective = behavior == null ? new ClientBehavior() : behavior;
        target.put("multiplier", multiplierOf(effective));
        target.put("successRate", effective.getSuccessRate());
        target.put("avgInterval", effective.getAvgInterval());
    }

    /**
     * 单个客户端的行为统计，由外层锁保护。
     */
    @Getter
    private static final class ClientBehavior {

        private double successRate = INITIAL_SUCCESS_RATE;
        private double avgInterval = INITIAL_AVG_INTERVAL_SECONDS;
        private Instant lastRequest;
        private Instant lastSeen = Instant.EPOCH;

        void observeRequest(Instant now) {
            if (lastRequest != null) {
                double interval = Math.max(0D, Duration.between(lastRequest, now).toNanos() / 1_000_000_000D);
                avgInterval = avgInterval * (1D - EWMA_WEIGHT) + interval * EWMA_WEIGHT;
            }
            lastRequest = now;
            touch(now);
        }

        void observeResult(boolean success, Instant now) {
            double sample = success ? 1D : 0D;
            successRate = successRate * (1D - EWMA_WEIGHT) + sample * EWMA_WEIGHT;
            touch(now);
        }

        private void touch(Instant now) {
            if (now.isAfter(lastSeen)) {
                lastSeen = now;
            }
        }
    }

}
