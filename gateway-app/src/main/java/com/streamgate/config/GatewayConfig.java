package com.streamgate.config;

import com.streamgate.domain.admission.service.AdaptiveRateLimiter;
import com.streamgate.domain.admission.service.RateLimiter;
import com.streamgate.domain.admission.service.TokenBucketRateLimiter;
import com.streamgate.domain.session.service.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * 网关组装根：时钟、限流器与会话表都在这里构造并以 Bean 形式注入，不使用静态单例。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    private static final int DEFAULT_REQUESTS = 100;
    private static final long DEFAULT_WINDOW_SECONDS = 60L;
    private static final int DEFAULT_MAX_SESSIONS = 100;
    private static final long DEFAULT_SESSION_TIMEOUT_SECONDS = 3600L;

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenBucketRateLimiter tokenBucketRateLimiter(GatewayProperties properties, Clock clock) {
        GatewayProperties.RateLimit rateLimit = rateLimitOf(properties);
        return new TokenBucketRateLimiter(
                positiveOrDefault(rateLimit.getRequests(), DEFAULT_REQUESTS),
                positiveOrDefault(rateLimit.getWindowSeconds(), DEFAULT_WINDOW_SECONDS),
                clock);
    }

    /**
     * 对外暴露的限流器：启用自适应时为装饰器，否则为基础令牌桶。
     */
    @Bean
    @Primary
    public RateLimiter rateLimiter(GatewayProperties properties, TokenBucketRateLimiter tokenBucketRateLimiter, Clock clock) {
        GatewayProperties.Adaptive adaptive = rateLimitOf(properties).getAdaptive();
        if (adaptive == null || !Boolean.TRUE.equals(adaptive.getEnabled())) {
            log.info("RATE_LIMITER_MODE mode=token_bucket");
            return tokenBucketRateLimiter;
        }
        double minMultiplier = adaptive.getMinMultiplier() == null || adaptive.getMinMultiplier() <= 0D
                ? 0.5D : adaptive.getMinMultiplier();
        double maxMultiplier = adaptive.getMaxMultiplier() == null
                ? 2.0D : Math.max(adaptive.getMaxMultiplier(), minMultiplier);
        log.info("RATE_LIMITER_MODE mode=adaptive, minMultiplier={}, maxMultiplier={}", minMultiplier, maxMultiplier);
        return new AdaptiveRateLimiter(tokenBucketRateLimiter, minMultiplier, maxMultiplier, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public SessionRegistry sessionRegistry(GatewayProperties properties, Clock clock) {
        GatewayProperties.Session session = properties.getSession() == null
                ? new GatewayProperties.Session() : properties.getSession();
        return new SessionRegistry(
                positiveOrDefault(session.getMaxSessions(), DEFAULT_MAX_SESSIONS),
                positiveOrDefault(session.getSessionTimeoutSeconds(), DEFAULT_SESSION_TIMEOUT_SECONDS),
                clock);
    }

    private GatewayProperties.RateLimit rateLimitOf(GatewayProperties properties) {
        return properties.getRateLimit() == null ? new GatewayProperties.RateLimit() : properties.getRateLimit();
    }

    /**
     * 空值回退默认值，非正数归一为 1。
     */
    private int positiveOrDefault(Integer value, int defaultValue) {
        return value == null ? defaultValue : Math.max(value, 1);
    }

    private long positiveOrDefault(Long value, long defaultValue) {
        return value == null ? defaultValue : Math.max(value, 1L);
    }

}
