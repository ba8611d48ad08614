package com.streamgate.trigger.job;

import com.streamgate.domain.session.service.SessionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 会话过期清理守护进程：每个 cleanup 周期移除空闲超过 sessionTimeout 的会话。
 */
@Slf4j
@Component
public class SessionSweepDaemon {

    private final SessionRegistry sessionRegistry;
    private final Counter expiredCounter;

    public SessionSweepDaemon(SessionRegistry sessionRegistry,
                              ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.sessionRegistry = sessionRegistry;
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.expiredCounter = Counter.builder("gateway.session.expired.total").register(meterRegistry);
    }

    @Scheduled(initialDelayString = "#{${gateway.session.cleanup-interval-seconds:60} * 1000}",
            fixedDelayString = "#{${gateway.session.cleanup-interval-seconds:60} * 1000}",
            scheduler = "daemonScheduler")
    public void sweepExpiredSessions() {
        try {
            int expired = sessionRegistry.sweepExpired();
            if (expired > 0) {
                expiredCounter.increment(expired);
                log.info("SESSION_SWEEP_COMPLETED expired={}, remaining={}", expired, sessionRegistry.count());
            }
        } catch (Exception ex) {
            log.error("SESSION_SWEEP_FAILED error={}", ex.getMessage(), ex);
        }
    }

}
