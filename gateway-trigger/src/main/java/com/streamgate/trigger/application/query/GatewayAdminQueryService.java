package com.streamgate.trigger.application.query;

import com.streamgate.api.dto.GatewayStatsDTO;
import com.streamgate.api.dto.RateLimitStatusDTO;
import com.streamgate.api.dto.SessionDetailDTO;
import com.streamgate.api.dto.SessionSummaryDTO;
import com.streamgate.domain.admission.service.RateLimiter;
import com.streamgate.domain.session.service.SessionRegistry;
import com.streamgate.infrastructure.util.JsonCodec;
import com.streamgate.trigger.application.common.SessionDetailViewAssembler;
import com.streamgate.trigger.application.stream.ConnectionDispatcher;
import com.streamgate.types.exception.SessionNotFoundException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 管理端只读查询：会话列表与详情、限流状态、整体统计。查询不刷新会话活跃度。
 */
@Service
public class GatewayAdminQueryService {

    private final SessionRegistry sessionRegistry;
    private final RateLimiter rateLimiter;
    private final ConnectionDispatcher connectionDispatcher;
    private final SessionDetailViewAssembler sessionDetailViewAssembler;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    public GatewayAdminQueryService(SessionRegistry sessionRegistry,
                                    RateLimiter rateLimiter,
                                    ConnectionDispatcher connectionDispatcher,
                                    SessionDetailViewAssembler sessionDetailViewAssembler,
                                    JsonCodec jsonCodec,
                                    Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.rateLimiter = rateLimiter;
        this.connectionDispatcher = connectionDispatcher;
        this.sessionDetailViewAssembler = sessionDetailViewAssembler;
        this.jsonCodec = jsonCodec;
        this.clock = clock;
    }

    public List<SessionSummaryDTO> listSessions() {
        return sessionRegistry.list().stream()
                .map(sessionDetailViewAssembler::toSummaryDTO)
                .collect(Collectors.toList());
    }

    public SessionDetailDTO getSession(String sessionId) {
        return sessionRegistry.find(sessionId)
                .map(snapshot -> sessionDetailViewAssembler.toDetailDTO(snapshot, connectionDispatcher.isConnected(sessionId)))
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Map<String, Object> rateLimitStats() {
        return rateLimiter.stats();
    }

    public RateLimitStatusDTO rateLimitStatus(String clientId) {
        Optional<Map<String, Object>> stats = rateLimiter.clientStats(clientId);
        RateLimitStatusDTO dto = new RateLimitStatusDTO();
        dto.setClientId(clientId);
        dto.setTracked(stats.isPresent());
        dto.setRemainingTokens(rateLimiter.remainingTokens(clientId));
        dto.setTimeUntilNextToken(rateLimiter.timeUntilNextToken(clientId));
        dto.setStats(stats.orElse(Map.of()));
        return dto;
    }

    public GatewayStatsDTO stats() {
        GatewayStatsDTO dto = new GatewayStatsDTO();
        dto.setSessions(jsonCodec.toMap(sessionRegistry.stats()));
        dto.setRateLimits(rateLimiter.stats());
        dto.setActiveConnections(connectionDispatcher.activeConnections());
        dto.setGeneratedAt(clock.instant().toString());
        return dto;
    }

}
