package com.streamgate.trigger.application.command;

import com.streamgate.api.dto.BroadcastRequestDTO;
import com.streamgate.api.dto.BroadcastResponseDTO;
import com.streamgate.api.dto.RateLimitResetResponseDTO;
import com.streamgate.api.dto.SessionDisconnectResponseDTO;
import com.streamgate.domain.admission.service.RateLimiter;
import com.streamgate.domain.session.service.SessionRegistry;
import com.streamgate.trigger.application.sse.StreamEventFramer;
import com.streamgate.types.enums.ResponseCode;
import com.streamgate.types.exception.AppException;
import com.streamgate.types.exception.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 管理端写操作：强制断开、广播、重置限流。
 */
@Slf4j
@Service
public class GatewayAdminCommandService {

    private final SessionRegistry sessionRegistry;
    private final RateLimiter rateLimiter;
    private final StreamEventFramer eventFramer;

    public GatewayAdminCommandService(SessionRegistry sessionRegistry,
                                      RateLimiter rateLimiter,
                                      StreamEventFramer eventFramer) {
        this.sessionRegistry = sessionRegistry;
        this.rateLimiter = rateLimiter;
        this.eventFramer = eventFramer;
    }

    /**
     * 移除会话；其推送连接会在下一次轮询时发现并关闭。
     */
    public SessionDisconnectResponseDTO disconnect(String sessionId) {
        if (!sessionRegistry.remove(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("ADMIN_SESSION_DISCONNECTED sessionId={}", sessionId);
        SessionDisconnectResponseDTO data = new SessionDisconnectResponseDTO();
        data.setSessionId(sessionId);
        data.setDisconnected(true);
        return data;
    }

    public BroadcastResponseDTO broadcast(BroadcastRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getMessage())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "message 不能为空");
        }
        int recipients = sessionRegistry.broadcast(
                eventFramer.broadcastMessage(request.getMessage(), request.getContext()),
                StringUtils.trimToNull(request.getExcludeSessionId()));
        log.info("ADMIN_BROADCAST recipients={}, excludeSessionId={}", recipients, request.getExcludeSessionId());
        BroadcastResponseDTO data = new BroadcastResponseDTO();
        data.setRecipients(recipients);
        return data;
    }

    public RateLimitResetResponseDTO resetRateLimit(String clientId) {
        boolean reset = rateLimiter.reset(clientId);
        log.info("ADMIN_RATE_LIMIT_RESET clientId={}, tracked={}", clientId, reset);
        RateLimitResetResponseDTO data = new RateLimitResetResponseDTO();
        data.setClientId(clientId);
        data.setReset(reset);
        return data;
    }

}
