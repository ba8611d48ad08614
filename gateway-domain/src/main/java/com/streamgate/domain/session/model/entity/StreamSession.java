package com.streamgate.domain.session.model.entity;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * 推送会话领域实体。
 * <p>
 * 身份与活跃度字段只在 {@code SessionRegistry} 的锁内修改；出站队列为单消费者 FIFO，
 * 由该会话的推送连接在锁外轮询。会话被移除后 {@code closed=true}，不再接收消息。
 * </p>
 */
@Getter
public class StreamSession {

    /**
     * 会话 ID
     */
    private final String sessionId;

    /**
     * 所属用户 ID
     */
    private final String userId;

    /**
     * 建立连接时看到的远端地址（可空）
     */
    private final String clientAddress;

    /**
     * 创建时间
     */
    private final Instant createdAt;

    /**
     * 最近活跃时间，单调不减
     */
    private volatile Instant lastActive;

    /**
     * 活跃次数，每次 touch 自增
     */
    private volatile long requestCount;

    /**
     * 是否已完成初始化握手
     */
    private volatile boolean initialized;

    /**
     * 是否已被移除
     */
    private volatile boolean closed;

    /**
     * 扩展元数据
     */
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();

    private final BlockingDeque<Map<String, Object>> outboundQueue = new LinkedBlockingDeque<>();

    public StreamSession(String sessionId, String userId, String clientAddress, Instant createdAt) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.clientAddress = clientAddress;
        this.createdAt = createdAt;
        this.lastActive = createdAt;
    }

    /**
     * 记录一次活跃；时钟回拨时 lastActive 保持不变。
     */
    public void touch(Instant now) {
        if (now.isAfter(lastActive)) {
            this.lastActive = now;
        }
        this.requestCount++;
    }

    public void markInitialized() {
        this.initialized = true;
    }

    /**
     * 入队出站消息。
     *
     * @return 会话已关闭时返回 false
     */
    public boolean enqueue(Map<String, Object> message) {
        if (closed) {
            return false;
        }
        return outboundQueue.offer(message);
    }

    /**
     * 把已取出但未投递的消息放回队首，供接管该会话的连接按原顺序继续投递。
     *
     * @return 会话已关闭时返回 false
     */
    public boolean requeueFirst(Map<String, Object> message) {
        if (closed) {
            return false;
        }
        return outboundQueue.offerFirst(message);
    }

    public Map<String, Object> poll(long timeout, TimeUnit unit) throws InterruptedException {
        return outboundQueue.poll(timeout, unit);
    }

    public int queueSize() {
        return outboundQueue.size();
    }

    /**
     * 关闭会话并丢弃未投递的消息。
     *
     * @return 丢弃的消息数
     */
    public int close() {
        this.closed = true;
        int dropped = outboundQueue.size();
        outboundQueue.clear();
        return dropped;
    }

    /**
     * 空闲时长严格大于 timeout 才视为过期。
     */
    public boolean isIdleLongerThan(Instant now, Duration timeout) {
        return Duration.between(lastActive, now).compareTo(timeout) > 0;
    }

}
