package com.streamgate.domain.session.model.valobj;

import com.streamgate.domain.session.model.entity.StreamSession;

import java.time.Instant;
import java.util.Map;

/**
 * 会话只读快照，供管理视图使用，不触碰活跃度。
 */
public record SessionSnapshot(String sessionId,
                              String userId,
                              String clientAddress,
                              Instant createdAt,
                              Instant lastActive,
                              long requestCount,
                              boolean initialized,
                              int queueSize,
                              Map<String, Object> metadata) {

    public static SessionSnapshot of(StreamSession session) {
        return new SessionSnapshot(
                session.getSessionId(),
                session.getUserId(),
                session.getClientAddress(),
                session.getCreatedAt(),
                session.getLastActive(),
                session.getRequestCount(),
                session.isInitialized(),
                session.queueSize(),
                Map.copyOf(session.getMetadata())
        );
    }
}
