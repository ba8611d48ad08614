package com.streamgate.trigger.application.sse;

import com.streamgate.trigger.application.stream.EventStreamTransport;
import com.streamgate.trigger.application.stream.StreamEventFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 {@link SseEmitter} 的推送连接写出端。
 */
@Slf4j
public class SseEmitterTransport implements EventStreamTransport {

    private final SseEmitter emitter;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public SseEmitterTransport(SseEmitter emitter) {
        this.emitter = emitter;
        emitter.onCompletion(() -> open.set(false));
        emitter.onTimeout(() -> open.set(false));
        emitter.onError(ex -> {
            open.set(false);
            log.debug("SSE_EMITTER_ERROR error={}", ex == null ? null : ex.getMessage());
        });
    }

    @Override
    public void send(StreamEventFrame frame) throws IOException {
        SseEmitter.SseEventBuilder builder = SseEmitter.event()
                .name(frame.event())
                .data(frame.data())
                .reconnectTime(frame.retryMs());
        if (frame.id() != null) {
            builder.id(frame.id());
        }
        try {
            emitter.send(builder);
        } catch (IOException | IllegalStateException ex) {
            open.set(false);
            throw ex;
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void complete() {
        if (open.getAndSet(false)) {
            emitter.complete();
        }
    }

}
