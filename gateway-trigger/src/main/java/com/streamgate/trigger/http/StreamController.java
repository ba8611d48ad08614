package com.streamgate.trigger.http;

import com.streamgate.trigger.application.sse.SseEmitterTransport;
import com.streamgate.trigger.application.stream.ConnectionDispatcher;
import com.streamgate.types.common.Constants;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

/**
 * 推送流接入 API：每个客户端一条 SSE 通道。
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class StreamController {

    private final ConnectionDispatcher connectionDispatcher;
    private final ClientIdentityResolver clientIdentityResolver;
    private final String defaultUserId;
    private final long emitterTimeoutMs;

    public StreamController(ConnectionDispatcher connectionDispatcher,
                            ClientIdentityResolver clientIdentityResolver,
                            @Value("${gateway.session.default-user-id:default_user}") String defaultUserId,
                            @Value("${gateway.stream.emitter-timeout-ms:0}") long emitterTimeoutMs) {
        this.connectionDispatcher = connectionDispatcher;
        this.clientIdentityResolver = clientIdentityResolver;
        this.defaultUserId = StringUtils.defaultIfBlank(defaultUserId, "default_user");
        this.emitterTimeoutMs = Math.max(emitterTimeoutMs, 0L);
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(value = "user_id", required = false) String userId,
                             @RequestParam(value = "session_id", required = false) String sessionId,
                             HttpServletRequest request,
                             HttpServletResponse response) {
        String resolvedUserId = StringUtils.defaultIfBlank(StringUtils.trimToNull(userId), defaultUserId);
        String resolvedSessionId = StringUtils.defaultIfBlank(StringUtils.trimToNull(sessionId), UUID.randomUUID().toString());
        String clientAddress = clientIdentityResolver.resolveAddress(request);

        response.setHeader("Cache-Control", "no-cache, no-transform");
        response.setHeader("X-Accel-Buffering", "no");
        response.setHeader("Connection", "keep-alive");
        response.setHeader(Constants.HEADER_SESSION_ID, resolvedSessionId);

        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        connectionDispatcher.open(resolvedUserId, resolvedSessionId, clientAddress, new SseEmitterTransport(emitter));
        log.info("STREAM_SUBSCRIBED sessionId={}, userId={}, clientAddress={}", resolvedSessionId, resolvedUserId, clientAddress);
        return emitter;
    }

}
