package com.streamgate.trigger.application.sse;

import com.streamgate.infrastructure.util.JsonCodec;
import com.streamgate.trigger.application.stream.StreamEventFrame;
import com.streamgate.types.common.Constants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 出站消息到 SSE 事件的映射，以及网关自身产生的保留消息。
 * <p>
 * 事件名取消息的 event 字段，其次 type 字段，缺省为 message；
 * 事件 ID 取消息的 id 字段，缺省为连接内序号；心跳不带 ID。
 * </p>
 */
@Component
public class StreamEventFramer {

    private final JsonCodec jsonCodec;
    private final Clock clock;
    private final long retryIntervalMs;

    public StreamEventFramer(JsonCodec jsonCodec,
                             Clock clock,
                             @Value("${gateway.stream.retry-interval-ms:5000}") long retryIntervalMs) {
        this.jsonCodec = jsonCodec;
        this.clock = clock;
        this.retryIntervalMs = retryIntervalMs <= 0 ? 5000L : retryIntervalMs;
    }

    public StreamEventFrame frame(Map<String, Object> message, long sequence) {
        String data = jsonCodec.toJson(message);
        if (isHeartbeat(message)) {
            return new StreamEventFrame(null, Constants.EVENT_HEARTBEAT, data, retryIntervalMs);
        }
        String eventId = textOf(message.get(Constants.FIELD_ID));
        return new StreamEventFrame(
                eventId == null ? String.valueOf(sequence) : eventId,
                resolveEventName(message),
                data,
                retryIntervalMs
        );
    }

    public boolean isHeartbeat(Map<String, Object> message) {
        return message != null && Constants.EVENT_HEARTBEAT.equals(message.get(Constants.FIELD_TYPE));
    }

    public Map<String, Object> heartbeatMessage() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(Constants.FIELD_TYPE, Constants.EVENT_HEARTBEAT);
        message.put(Constants.FIELD_TIMESTAMP, clock.instant().toString());
        return message;
    }

    public Map<String, Object> connectedMessage(String sessionId, String userId) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(Constants.FIELD_TYPE, Constants.EVENT_CONNECTION);
        message.put("status", "connected");
        message.put("sessionId", sessionId);
        message.put("userId", userId);
        message.put(Constants.FIELD_TIMESTAMP, clock.instant().toString());
        return message;
    }

    public Map<String, Object> broadcastMessage(String content, Map<String, Object> context) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(Constants.FIELD_TYPE, Constants.EVENT_BROADCAST);
        message.put("content", content);
        message.put("context", context == null ? Map.of() : context);
        message.put(Constants.FIELD_TIMESTAMP, clock.instant().toString());
        return message;
    }

    private String resolveEventName(Map<String, Object> message) {
        String event = textOf(message.get(Constants.FIELD_EVENT));
        if (event != null) {
            return event;
        }
        String type = textOf(message.get(Constants.FIELD_TYPE));
        return type == null ? Constants.EVENT_DEFAULT : type;
    }

    private String textOf(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

}
