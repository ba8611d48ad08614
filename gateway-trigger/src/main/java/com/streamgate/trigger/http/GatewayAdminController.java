package com.streamgate.trigger.http;

import com.streamgate.api.dto.BroadcastRequestDTO;
import com.streamgate.api.dto.BroadcastResponseDTO;
import com.streamgate.api.dto.GatewayStatsDTO;
import com.streamgate.api.dto.RateLimitResetResponseDTO;
import com.streamgate.api.dto.RateLimitStatusDTO;
import com.streamgate.api.dto.SessionDetailDTO;
import com.streamgate.api.dto.SessionDisconnectResponseDTO;
import com.streamgate.api.dto.SessionSummaryDTO;
import com.streamgate.api.response.Response;
import com.streamgate.trigger.application.command.GatewayAdminCommandService;
import com.streamgate.trigger.application.query.GatewayAdminQueryService;
import com.streamgate.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 运维管理 API：会话、限流与整体统计。
 */
@RestController
@RequestMapping("/api/admin")
public class GatewayAdminController {

    private final GatewayAdminQueryService gatewayAdminQueryService;
    private final GatewayAdminCommandService gatewayAdminCommandService;

    public GatewayAdminController(GatewayAdminQueryService gatewayAdminQueryService,
                                  GatewayAdminCommandService gatewayAdminCommandService) {
        this.gatewayAdminQueryService = gatewayAdminQueryService;
        this.gatewayAdminCommandService = gatewayAdminCommandService;
    }

    @GetMapping("/sessions")
    public Response<List<SessionSummaryDTO>> listSessions() {
        return success(gatewayAdminQueryService.listSessions());
    }

    @GetMapping("/sessions/{sessionId}")
    public Response<SessionDetailDTO> getSession(@PathVariable("sessionId") String sessionId) {
        return success(gatewayAdminQueryService.getSession(sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Response<SessionDisconnectResponseDTO> disconnectSession(@PathVariable("sessionId") String sessionId) {
        return success(gatewayAdminCommandService.disconnect(sessionId));
    }

    @GetMapping("/rate-limits")
    public Response<Map<String, Object>> rateLimits() {
        return success(gatewayAdminQueryService.rateLimitStats());
    }

    @GetMapping("/rate-limits/{clientId}")
    public Response<RateLimitStatusDTO> rateLimitStatus(@PathVariable("clientId") String clientId) {
        return success(gatewayAdminQueryService.rateLimitStatus(clientId));
    }

    @PostMapping("/rate-limits/{clientId}/reset")
    public Response<RateLimitResetResponseDTO> resetRateLimit(@PathVariable("clientId") String clientId) {
        return success(gatewayAdminCommandService.resetRateLimit(clientId));
    }

    @PostMapping("/broadcast")
    public Response<BroadcastResponseDTO> broadcast(@RequestBody BroadcastRequestDTO request) {
        return success(gatewayAdminCommandService.broadcast(request));
    }

    @GetMapping("/stats")
    public Response<GatewayStatsDTO> stats() {
        return success(gatewayAdminQueryService.stats());
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }

}
