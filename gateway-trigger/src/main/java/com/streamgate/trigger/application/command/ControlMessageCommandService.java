package com.streamgate.trigger.application.command;

import com.streamgate.api.dto.ControlMessageAcceptedDTO;
import com.streamgate.domain.admission.model.valobj.RateLimitDecision;
import com.streamgate.domain.admission.service.RateLimiter;
import com.streamgate.domain.session.service.SessionRegistry;
import com.streamgate.types.common.Constants;
import com.streamgate.types.enums.ResponseCode;
import com.streamgate.types.exception.AppException;
import com.streamgate.types.exception.RateLimitedException;
import com.streamgate.types.exception.SessionNotFoundException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 控制消息受理：先限流，再校验会话，最后入队并把结果反馈给限流器。
 */
@Slf4j
@Service
public class ControlMessageCommandService {

    private static final Set<String> INITIALIZE_METHODS = Set.of("initialize", "notifications/initialized");

    private final RateLimiter rateLimiter;
    private final SessionRegistry sessionRegistry;
    private final Counter deniedCounter;

    public ControlMessageCommandService(RateLimiter rateLimiter,
                                        SessionRegistry sessionRegistry,
                                        ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.rateLimiter = rateLimiter;
        this.sessionRegistry = sessionRegistry;
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.deniedCounter = Counter.builder("gateway.ratelimit.denied.total").register(meterRegistry);
    }

    public ControlMessageAcceptedDTO submit(String clientId, String sessionId, Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "message body must be a non-empty JSON object");
        }
        RateLimitDecision decision = rateLimiter.allow(clientId);
        if (!decision.allowed()) {
            deniedCounter.increment();
            throw new RateLimitedException(clientId, decision.retryAfterSeconds());
        }
        if (!sessionRegistry.touch(sessionId)) {
            rateLimiter.recordResult(clientId, false);
            throw new SessionNotFoundException(sessionId);
        }
        boolean initialize = INITIALIZE_METHODS.contains(String.valueOf(payload.get(Constants.FIELD_METHOD)));
        if (initialize) {
            sessionRegistry.markInitialized(sessionId);
        }
        boolean queued = sessionRegistry.sendTo(sessionId, new LinkedHashMap<>(payload));
        rateLimiter.recordResult(clientId, queued);
        if (!queued) {
            throw new SessionNotFoundException(sessionId);
        }
        log.debug("CONTROL_MESSAGE_ACCEPTED sessionId={}, clientId={}, method={}, remainingTokens={}",
                sessionId, clientId, payload.get(Constants.FIELD_METHOD), decision.remainingTokens());

        ControlMessageAcceptedDTO data = new ControlMessageAcceptedDTO();
        data.setSessionId(sessionId);
        data.setAccepted(true);
        data.setInitialized(initialize || sessionRegistry.find(sessionId).map(s -> s.initialized()).orElse(false));
        data.setRemainingTokens(decision.remainingTokens());
        return data;
    }

}
