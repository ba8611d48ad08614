package com.streamgate.domain.admission.model.valobj;

/**
 * 一次准入判定结果。
 *
 * @param allowed           是否放行
 * @param remainingTokens   判定后桶内剩余令牌
 * @param retryAfterSeconds 拒绝时建议等待秒数，放行时为 0
 */
public record RateLimitDecision(boolean allowed, double remainingTokens, double retryAfterSeconds) {

    public static RateLimitDecision allow(double remainingTokens) {
        return new RateLimitDecision(true, remainingTokens, 0D);
    }

    public static RateLimitDecision deny(double remainingTokens, double retryAfterSeconds) {
        return new RateLimitDecision(false, remainingTokens, Math.max(retryAfterSeconds, 0D));
    }
}
