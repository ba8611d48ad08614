package com.streamgate.trigger.job;

import com.streamgate.domain.admission.service.RateLimiter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * 限流桶清理守护进程。
 * <p>
 * 周期由限流器给出（{@code max(60s, window)}），因此在启动时以编程方式注册到 daemonScheduler。
 * </p>
 */
@Slf4j
@Component
public class RateLimiterCleanupDaemon {

    private final RateLimiter rateLimiter;
    private final TaskScheduler daemonScheduler;
    private volatile ScheduledFuture<?> cleanupFuture;

    public RateLimiterCleanupDaemon(RateLimiter rateLimiter,
                                    @Qualifier("daemonScheduler") TaskScheduler daemonScheduler) {
        this.rateLimiter = rateLimiter;
        this.daemonScheduler = daemonScheduler;
    }

    @PostConstruct
    public void start() {
        Duration interval = Duration.ofSeconds(rateLimiter.getCleanupIntervalSeconds());
        cleanupFuture = daemonScheduler.scheduleWithFixedDelay(this::cleanupInactiveClients,
                Instant.now().plus(interval), interval);
        log.info("RATE_LIMIT_CLEANUP_SCHEDULED intervalSeconds={}", interval.getSeconds());
    }

    public void cleanupInactiveClients() {
        try {
            rateLimiter.cleanupInactive();
        } catch (Exception ex) {
            log.error("RATE_LIMIT_CLEANUP_FAILED error={}", ex.getMessage(), ex);
        }
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> future = cleanupFuture;
        if (future != null) {
            future.cancel(false);
        }
    }

}
