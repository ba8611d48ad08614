package com.streamgate.test;

import com.streamgate.domain.admission.service.RateLimiter;
import com.streamgate.domain.admission.service.TokenBucketRateLimiter;
import com.streamgate.domain.session.service.SessionRegistry;
import com.streamgate.test.support.MutableClock;
import com.streamgate.trigger.job.RateLimiterCleanupDaemon;
import com.streamgate.trigger.job.SessionSweepDaemon;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class GatewayDaemonTest {

    @Test
    public void shouldSweepExpiredSessionsAndCountThem() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        SessionRegistry sessionRegistry = new SessionRegistry(10, 60L, clock);
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        SessionSweepDaemon daemon = new SessionSweepDaemon(sessionRegistry, meterRegistryProvider(meterRegistry));
        sessionRegistry.create("user-1", "idle-1");
        sessionRegistry.create("user-2", "idle-2");
        clock.advanceSeconds(40L);
        sessionRegistry.create("user-3", "fresh");
        clock.advanceSeconds(21L);

        daemon.sweepExpiredSessions();

        Assertions.assertEquals(1, sessionRegistry.count());
        Assertions.assertTrue(sessionRegistry.find("fresh").isPresent());
        Assertions.assertEquals(2D, meterRegistry.counter("gateway.session.expired.total").count(), 1e-9D);
    }

    @Test
    public void shouldSwallowSweepFailure() {
        SessionRegistry sessionRegistry = mock(SessionRegistry.class);
        when(sessionRegistry.sweepExpired()).thenThrow(new IllegalStateException("registry unavailable"));
        SessionSweepDaemon daemon = new SessionSweepDaemon(sessionRegistry, meterRegistryProvider(new SimpleMeterRegistry()));

        Assertions.assertDoesNotThrow(daemon::sweepExpiredSessions);
    }

    @Test
    public void shouldScheduleLimiterCleanupAtLimiterInterval() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        TokenBucketRateLimiter rateLimiter = new TokenBucketRateLimiter(100, 300L, clock);
        TaskScheduler scheduler = mock(TaskScheduler.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        RateLimiterCleanupDaemon daemon = new RateLimiterCleanupDaemon(rateLimiter, scheduler);

        daemon.start();
        daemon.stop();

        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofSeconds(300L)));
        verify(future).cancel(false);
    }

    @Test
    public void shouldDropIdleBucketsOnCleanup() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        TokenBucketRateLimiter rateLimiter = new TokenBucketRateLimiter(5, 60L, clock);
        RateLimiterCleanupDaemon daemon = new RateLimiterCleanupDaemon(rateLimiter, mock(TaskScheduler.class));
        rateLimiter.allow("10.0.0.7");
        clock.advanceSeconds(121L);

        daemon.cleanupInactiveClients();

        Assertions.assertEquals(0, rateLimiter.trackedClients());
    }

    @Test
    public void shouldSwallowCleanupFailure() {
        RateLimiter rateLimiter = mock(RateLimiter.class);
        when(rateLimiter.cleanupInactive()).thenThrow(new IllegalStateException("boom"));
        RateLimiterCleanupDaemon daemon = new RateLimiterCleanupDaemon(rateLimiter, mock(TaskScheduler.class));

        Assertions.assertDoesNotThrow(daemon::cleanupInactiveClients);
    }

    private ObjectProvider<MeterRegistry> meterRegistryProvider(MeterRegistry meterRegistry) {
        DefaultListableBeanFactory beanFactory = new DefaultListableBeanFactory();
        beanFactory.registerSingleton("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
