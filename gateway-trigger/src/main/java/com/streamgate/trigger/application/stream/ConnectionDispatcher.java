package com.streamgate.trigger.application.stream;

import com.streamgate.domain.session.model.entity.StreamSession;
import com.streamgate.domain.session.service.SessionRegistry;
import com.streamgate.trigger.application.sse.StreamEventFramer;
import com.streamgate.types.enums.ConnectionStateEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 推送连接调度器：每条连接一个读循环加一个心跳定时任务。
 * <p>
 * 读循环在 streamDispatchExecutor 上按短超时轮询会话队列，逐条写出；
 * 心跳任务在 daemonScheduler 上运行，只有在一个心跳周期内没有写出过业务事件时才入队心跳。
 * 对端断开、会话被移除、关闭信号或写失败都会使连接进入 CLOSED，并移除其会话。
 * 同一 sessionId 的新连接会顶替旧连接：新连接等待旧读循环退出后才开始消费队列，
 * 旧循环在失去归属后取到的消息放回队首，被顶替的旧连接结束时不移除会话。
 * connected 事件由读循环直接写出，因此总是新连接上的第一个事件。
 * </p>
 */
@Slf4j
@Component
public class ConnectionDispatcher {

    private static final long SUPERSEDE_AWAIT_MARGIN_MS = 1000L;

    private final SessionRegistry sessionRegistry;
    private final StreamEventFramer eventFramer;
    private final TaskScheduler daemonScheduler;
    private final Executor streamDispatchExecutor;
    private final long heartbeatIntervalMs;
    private final long pollTimeoutMs;
    private final long shutdownAwaitMs;
    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final Counter eventSentCounter;
    private final Counter eventFailCounter;
    private final Counter heartbeatCounter;

    public ConnectionDispatcher(SessionRegistry sessionRegistry,
                                StreamEventFramer eventFramer,
                                @Qualifier("daemonScheduler") TaskScheduler daemonScheduler,
                                @Qualifier("streamDispatchExecutor") Executor streamDispatchExecutor,
                                ObjectProvider<MeterRegistry> meterRegistryProvider,
                                @Value("#{${gateway.stream.heartbeat-interval-seconds:30} * 1000}") long heartbeatIntervalMs,
                                @Value("${gateway.stream.poll-timeout-ms:100}") long pollTimeoutMs,
                                @Value("${gateway.stream.shutdown-await-ms:5000}") long shutdownAwaitMs) {
        this.sessionRegistry = sessionRegistry;
        this.eventFramer = eventFramer;
        this.daemonScheduler = daemonScheduler;
        this.streamDispatchExecutor = streamDispatchExecutor;
        this.heartbeatIntervalMs = heartbeatIntervalMs <= 0 ? 30_000L : heartbeatIntervalMs;
        this.pollTimeoutMs = pollTimeoutMs <= 0 ? 100L : pollTimeoutMs;
        this.shutdownAwaitMs = Math.max(shutdownAwaitMs, 0L);
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.eventSentCounter = Counter.builder("gateway.stream.event.sent.total").register(meterRegistry);
        this.eventFailCounter = Counter.builder("gateway.stream.event.fail.total").register(meterRegistry);
        this.heartbeatCounter = Counter.builder("gateway.stream.heartbeat.total").register(meterRegistry);
    }

    /**
     * 建立推送连接：登记会话，等待被顶替的旧读循环退出，再启动心跳与读循环。
     *
     * @return 实际绑定的 sessionId
     */
    public String open(String userId, String sessionId, String clientAddress, EventStreamTransport transport) {
        Connection connection = new Connection(userId, transport);
        String boundSessionId = sessionRegistry.create(userId, sessionId, clientAddress);
        connection.sessionId = boundSessionId;
        Connection previous = connections.put(boundSessionId, connection);
        if (previous != null) {
            previous.closeRequested = true;
            boolean released = awaitFinished(previous, pollTimeoutMs + SUPERSEDE_AWAIT_MARGIN_MS);
            log.info("STREAM_CONNECTION_SUPERSEDED sessionId={}, previousConnectionStartedAt={}, previousReleased={}",
                    boundSessionId, previous.startedAt, released);
        }
        connection.state.set(ConnectionStateEnum.STREAMING);
        try {
            connection.heartbeatFuture = daemonScheduler.scheduleWithFixedDelay(
                    () -> heartbeatTick(connection),
                    Instant.now().plusMillis(heartbeatIntervalMs),
                    Duration.ofMillis(heartbeatIntervalMs));
            streamDispatchExecutor.execute(() -> runReadLoop(connection));
        } catch (RejectedExecutionException ex) {
            log.warn("STREAM_CONNECTION_REJECTED sessionId={}, userId={}, error={}", boundSessionId, userId, ex.getMessage());
            finish(connection, "rejected");
            return boundSessionId;
        }
        if (connection.state.get() == ConnectionStateEnum.CLOSED) {
            cancelHeartbeat(connection);
        }
        log.info("STREAM_CONNECTION_OPENED sessionId={}, userId={}, clientAddress={}, heartbeatIntervalMs={}",
                boundSessionId, userId, clientAddress, heartbeatIntervalMs);
        return boundSessionId;
    }

    public int activeConnections() {
        return connections.size();
    }

    public boolean isConnected(String sessionId) {
        return sessionId != null && connections.containsKey(sessionId);
    }

    /**
     * 通知所有连接关闭，并在 shutdownAwaitMs 内等待读循环结束。
     */
    @PreDestroy
    public void shutdown() {
        List<Connection> snapshot = new ArrayList<>(connections.values());
        if (snapshot.isEmpty()) {
            return;
        }
        snapshot.forEach(connection -> connection.closeRequested = true);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(shutdownAwaitMs);
        int unfinished = 0;
        for (Connection connection : snapshot) {
            long remaining = deadline - System.nanoTime();
            try {
                if (!connection.finished.await(Math.max(remaining, 0L), TimeUnit.NANOSECONDS)) {
                    unfinished++;
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                unfinished++;
                break;
            }
        }
        log.info("STREAM_DISPATCHER_SHUTDOWN connections={}, unfinished={}", snapshot.size(), unfinished);
    }

    private void runReadLoop(Connection connection) {
        String reason = "closed";
        try {
            StreamSession session = sessionRegistry.get(connection.sessionId).orElse(null);
            if (session == null) {
                reason = "session_removed";
                return;
            }
            if (!deliver(connection, eventFramer.connectedMessage(connection.sessionId, connection.userId))) {
                reason = "write_failed";
                return;
            }
            while (true) {
                if (connection.closeRequested) {
                    reason = "close_requested";
                    break;
                }
                if (!connection.transport.isOpen()) {
                    reason = "peer_disconnected";
                    break;
                }
                if (session.isClosed()) {
                    reason = "session_removed";
                    break;
                }
                Map<String, Object> message = session.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
                if (message == null) {
                    continue;
                }
                if (!ownsSession(connection)) {
                    session.requeueFirst(message);
                    reason = connections.get(connection.sessionId) == connection ? "close_requested" : "handed_over";
                    break;
                }
                if (!deliver(connection, message)) {
                    reason = "write_failed";
                    break;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            reason = "interrupted";
        } catch (RuntimeException ex) {
            log.error("STREAM_READ_LOOP_FAILED sessionId={}, error={}", connection.sessionId, ex.getMessage(), ex);
            reason = "error";
        } finally {
            finish(connection, reason);
        }
    }

    private boolean deliver(Connection connection, Map<String, Object> message) {
        boolean heartbeat = eventFramer.isHeartbeat(message);
        StreamEventFrame frame = eventFramer.frame(message, heartbeat ? 0L : connection.sequence.incrementAndGet());
        try {
            connection.transport.send(frame);
        } catch (IOException | RuntimeException ex) {
            eventFailCounter.increment();
            log.warn("STREAM_EVENT_SEND_FAILED sessionId={}, event={}, error={}",
                    connection.sessionId, frame.event(), ex.getMessage());
            return false;
        }
        if (heartbeat) {
            connection.heartbeatPending.set(false);
            heartbeatCounter.increment();
        } else {
            connection.sentSinceLastTick.set(true);
            eventSentCounter.increment();
        }
        return true;
    }

    private void heartbeatTick(Connection connection) {
        try {
            if (connection.state.get() != ConnectionStateEnum.STREAMING || connection.closeRequested) {
                return;
            }
            if (connection.sentSinceLastTick.getAndSet(false)) {
                return;
            }
            if (!connection.heartbeatPending.compareAndSet(false, true)) {
                return;
            }
            if (!sessionRegistry.sendTo(connection.sessionId, eventFramer.heartbeatMessage())) {
                connection.heartbeatPending.set(false);
            }
        } catch (RuntimeException ex) {
            log.warn("STREAM_HEARTBEAT_FAILED sessionId={}, error={}", connection.sessionId, ex.getMessage());
        }
    }

    private void finish(Connection connection, String reason) {
        if (connection.state.getAndSet(ConnectionStateEnum.CLOSED) == ConnectionStateEnum.CLOSED) {
            return;
        }
        cancelHeartbeat(connection);
        boolean owner = connections.remove(connection.sessionId, connection);
        if (owner) {
            sessionRegistry.remove(connection.sessionId);
        }
        try {
            connection.transport.complete();
        } catch (RuntimeException ex) {
            log.debug("STREAM_TRANSPORT_COMPLETE_FAILED sessionId={}, error={}", connection.sessionId, ex.getMessage());
        }
        connection.finished.countDown();
        log.info("STREAM_CONNECTION_CLOSED sessionId={}, userId={}, reason={}, sentEvents={}, sessionRemoved={}",
                connection.sessionId, connection.userId, reason, connection.sequence.get(), owner);
    }

    private boolean ownsSession(Connection connection) {
        return !connection.closeRequested && connections.get(connection.sessionId) == connection;
    }

    private boolean awaitFinished(Connection connection, long timeoutMs) {
        try {
            return connection.finished.await(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void cancelHeartbeat(Connection connection) {
        ScheduledFuture<?> future = connection.heartbeatFuture;
        if (future != null) {
            future.cancel(false);
        }
    }

    private static final class Connection {
        private final String userId;
        private final EventStreamTransport transport;
        private final Instant startedAt = Instant.now();
        private final AtomicReference<ConnectionStateEnum> state = new AtomicReference<>(ConnectionStateEnum.CONNECTING);
        private final AtomicLong sequence = new AtomicLong(0L);
        private final AtomicBoolean sentSinceLastTick = new AtomicBoolean(false);
        private final AtomicBoolean heartbeatPending = new AtomicBoolean(false);
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile String sessionId;
        private volatile boolean closeRequested;
        private volatile ScheduledFuture<?> heartbeatFuture;

        private Connection(String userId, EventStreamTransport transport) {
            this.userId = userId;
            this.transport = transport;
        }
    }

}
