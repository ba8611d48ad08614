package com.streamgate.trigger.application.common;

import com.streamgate.api.dto.SessionDetailDTO;
import com.streamgate.api.dto.SessionSummaryDTO;
import com.streamgate.domain.session.model.valobj.SessionSnapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 会话视图组装器：统一 SessionSummaryDTO / SessionDetailDTO 映射。
 */
@Component
public class SessionDetailViewAssembler {

    private final Clock clock;

    public SessionDetailViewAssembler(Clock clock) {
        this.clock = clock;
    }

    public SessionSummaryDTO toSummaryDTO(SessionSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        SessionSummaryDTO dto = new SessionSummaryDTO();
        fill(dto, snapshot);
        return dto;
    }

    public SessionDetailDTO toDetailDTO(SessionSnapshot snapshot, boolean connected) {
        if (snapshot == null) {
            return null;
        }
        Instant now = clock.instant();
        SessionDetailDTO dto = new SessionDetailDTO();
        fill(dto, snapshot);
        dto.setAgeSeconds(secondsSince(snapshot.createdAt(), now));
        dto.setIdleSeconds(secondsSince(snapshot.lastActive(), now));
        dto.setConnected(connected);
        dto.setMetadata(snapshot.metadata());
        return dto;
    }

    private void fill(SessionSummaryDTO dto, SessionSnapshot snapshot) {
        dto.setSessionId(snapshot.sessionId());
        dto.setUserId(snapshot.userId());
        dto.setClientAddress(snapshot.clientAddress());
        dto.setCreatedAt(format(snapshot.createdAt()));
        dto.setLastActive(format(snapshot.lastActive()));
        dto.setRequestCount(snapshot.requestCount());
        dto.setInitialized(snapshot.initialized());
        dto.setQueueSize(snapshot.queueSize());
    }

    private String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private long secondsSince(Instant from, Instant now) {
        if (from == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(from, now).getSeconds());
    }

}
