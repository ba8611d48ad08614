package com.streamgate.test;

import com.streamgate.config.GatewayConfig;
import com.streamgate.config.GatewayProperties;
import com.streamgate.domain.admission.service.RateLimiter;
import com.streamgate.domain.admission.service.TokenBucketRateLimiter;
import com.streamgate.domain.session.service.SessionRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;

public class GatewayConfigTest {

    private final GatewayConfig gatewayConfig = new GatewayConfig();
    private final Clock clock = Clock.systemUTC();

    @Test
    public void shouldFallBackToDefaultsWhenKeysAreBlank() {
        GatewayProperties properties = new GatewayProperties();
        properties.getRateLimit().setRequests(null);
        properties.getRateLimit().setWindowSeconds(null);
        properties.getSession().setMaxSessions(null);
        properties.getSession().setSessionTimeoutSeconds(null);

        TokenBucketRateLimiter limiter = gatewayConfig.tokenBucketRateLimiter(properties, clock);
        SessionRegistry registry = gatewayConfig.sessionRegistry(properties, clock);

        Assertions.assertEquals(100, limiter.getRequestsPerWindow());
        Assertions.assertEquals(60L, limiter.getWindowSeconds());
        Assertions.assertEquals(100, registry.getMaxSessions());
    }

    @Test
    public void shouldNormalizeNonPositiveValues() {
        GatewayProperties properties = new GatewayProperties();
        properties.getRateLimit().setRequests(0);
        properties.getRateLimit().setWindowSeconds(-5L);
        properties.getSession().setMaxSessions(-1);

        TokenBucketRateLimiter limiter = gatewayConfig.tokenBucketRateLimiter(properties, clock);

        Assertions.assertEquals(1, limiter.getRequestsPerWindow());
        Assertions.assertEquals(1L, limiter.getWindowSeconds());
        Assertions.assertEquals(1, gatewayConfig.sessionRegistry(properties, clock).getMaxSessions());
    }

    @Test
    public void shouldUseBaseLimiterWhenAdaptiveSectionIsMissing() {
        GatewayProperties properties = new GatewayProperties();
        properties.getRateLimit().setAdaptive(null);
        TokenBucketRateLimiter limiter = gatewayConfig.tokenBucketRateLimiter(properties, clock);

        RateLimiter rateLimiter = gatewayConfig.rateLimiter(properties, limiter, clock);

        Assertions.assertSame(limiter, rateLimiter);
    }
}
