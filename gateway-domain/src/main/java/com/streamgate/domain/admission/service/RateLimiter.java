package com.streamgate.domain.admission.service;

import com.streamgate.domain.admission.model.valobj.RateLimitDecision;

import java.util.Map;
import java.util.Optional;

/**
 * 客户端限流器。
 * <p>
 * 所有方法线程安全；查询类方法不会为未知客户端创建令牌桶。
 * </p>
 */
public interface RateLimiter {

    /**
     * 以 cost=1 做准入判定。
     */
    default RateLimitDecision allow(String clientId) {
        return allow(clientId, 1D);
    }

    /**
     * 先补充再判定；不足时拒绝且不扣减。
     *
     * @throws IllegalArgumentException cost 为负数
     */
    RateLimitDecision allow(String clientId, double cost);

    default boolean isAllowed(String clientId) {
        return allow(clientId).allowed();
    }

    double remainingTokens(String clientId);

    /**
     * {@code max(0, (1 - tokens) / refillRate)}。
     */
    double timeUntilNextToken(String clientId);

    /**
     * 将客户端令牌桶恢复为满桶。
     *
     * @return 客户端是否存在令牌桶
     */
    boolean reset(String clientId);

    Optional<Map<String, Object>> clientStats(String clientId);

    Map<String, Object> stats();

    /**
     * 移除长期未访问且接近满桶的客户端。
     *
     * @return 移除数量
     */
    int cleanupInactive();

    long getCleanupIntervalSeconds();

    /**
     * 反馈请求处理结果，基础实现忽略。
     */
    default void recordResult(String clientId, boolean success) {
    }

}
