package com.streamgate.domain.session.service;

import com.google.common.base.Preconditions;
import com.streamgate.domain.session.model.entity.StreamSession;
import com.streamgate.domain.session.model.valobj.SessionRegistryStats;
import com.streamgate.domain.session.model.valobj.SessionSnapshot;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 进程内推送会话表。
 * <p>
 * 会话主表与 userId 索引由同一把锁保护：sessionId 在主表中当且仅当它出现在恰好一个用户的索引集合里。
 * 持锁期间不调用任何外部组件；消息入队在锁外进行，与移除竞争时消息可能被丢弃。
 * </p>
 */
@Slf4j
public class SessionRegistry {

    @Getter
    private final int maxSessions;
    private final Duration sessionTimeout;
    private final Clock clock;

    private final Map<String, StreamSession> sessions = new LinkedHashMap<>();
    private final Map<String, Set<String>> userSessions = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SessionRegistry(int maxSessions, long sessionTimeoutSeconds, Clock clock) {
        Preconditions.checkArgument(maxSessions > 0, "maxSessions must be positive: %s", maxSessions);
        Preconditions.checkArgument(sessionTimeoutSeconds > 0, "sessionTimeoutSeconds must be positive: %s", sessionTimeoutSeconds);
        this.maxSessions = maxSessions;
        this.sessionTimeout = Duration.ofSeconds(sessionTimeoutSeconds);
        this.clock = Preconditions.checkNotNull(clock, "clock");
        log.info("SESSION_REGISTRY_INITIALIZED maxSessions={}, sessionTimeoutSeconds={}", maxSessions, sessionTimeoutSeconds);
    }

    public String create(String userId, String sessionId) {
        return create(userId, sessionId, null);
    }

    /**
     * 创建会话；sessionId 为空时生成 UUID。已存在则仅刷新活跃度并返回原 ID。
     * 达到 maxSessions 时先淘汰 createdAt 最早的一个会话。
     */
    public String create(String userId, String sessionId, String clientAddress) {
        Preconditions.checkArgument(userId != null && !userId.isBlank(), "userId must not be blank");
        String resolvedId = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId.trim();
        Instant now = clock.instant();
        StreamSession evicted = null;
        lock.lock();
        try {
            StreamSession existing = sessions.get(resolvedId);
            if (existing != null) {
                existing.touch(now);
                if (!existing.getUserId().equals(userId)) {
                    log.warn("SESSION_USER_MISMATCH sessionId={}, ownerUserId={}, requestUserId={}",
                            resolvedId, existing.getUserId(), userId);
                }
                return resolvedId;
            }
            if (sessions.size() >= maxSessions) {
                evicted = evictOldestLocked();
            }
            StreamSession session = new StreamSession(resolvedId, userId, clientAddress, now);
            sessions.put(resolvedId, session);
            userSessions.computeIfAbsent(userId, key -> new LinkedHashSet<>()).add(resolvedId);
        } finally {
            lock.unlock();
        }
        if (evicted != null) {
            log.info("SESSION_EVICTED sessionId={}, userId={}, reason=capacity, maxSessions={}",
                    evicted.getSessionId(), evicted.getUserId(), maxSessions);
        }
        log.info("SESSION_CREATED sessionId={}, userId={}, clientAddress={}", resolvedId, userId, clientAddress);
        return resolvedId;
    }

    /**
     * 获取会话并刷新活跃度。
     */
    public Optional<StreamSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            StreamSession session = sessions.get(sessionId);
            if (session != null) {
                session.touch(now);
            }
            return Optional.ofNullable(session);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取会话快照，不刷新活跃度。
     */
    public Optional<SessionSnapshot> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId)).map(SessionSnapshot::of);
        } finally {
            lock.unlock();
        }
    }

    public boolean touch(String sessionId) {
        return get(sessionId).isPresent();
    }

    public boolean remove(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        StreamSession removed;
        int dropped;
        lock.lock();
        try {
            removed = removeLocked(sessionId);
            dropped = removed == null ? 0 : removed.close();
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        log.info("SESSION_REMOVED sessionId={}, userId={}, droppedMessages={}", sessionId, removed.getUserId(), dropped);
        return true;
    }

    public boolean markInitialized(String sessionId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            StreamSession session = sessions.get(sessionId);
            if (session == null) {
                return false;
            }
            session.markInitialized();
            session.touch(now);
        } finally {
            lock.unlock();
        }
        log.info("SESSION_INITIALIZED sessionId={}", sessionId);
        return true;
    }

    /**
     * 设置元数据；value 为 null 时删除该键。
     */
    public boolean setMetadata(String sessionId, String key, Object value) {
        Preconditions.checkNotNull(key, "key");
        lock.lock();
        try {
            StreamSession session = sessions.get(sessionId);
            if (session == null) {
                return false;
            }
            if (value == null) {
                session.getMetadata().remove(key);
            } else {
                session.getMetadata().put(key, value);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Object> getMetadata(String sessionId, String key) {
        lock.lock();
        try {
            StreamSession session = sessions.get(sessionId);
            if (session == null || key == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(session.getMetadata().get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 向除 excludeSessionId 外的所有会话投递消息；单个会话失败不影响其它会话。
     *
     * @return 成功入队的会话数
     */
    public int broadcast(Map<String, Object> message, String excludeSessionId) {
        Preconditions.checkNotNull(message, "message");
        List<StreamSession> targets;
        lock.lock();
        try {
            targets = new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
        int recipients = 0;
        for (StreamSession session : targets) {
            if (session.getSessionId().equals(excludeSessionId)) {
                continue;
            }
            try {
                if (session.enqueue(message)) {
                    recipients++;
                }
            } catch (RuntimeException ex) {
                log.warn("SESSION_BROADCAST_DELIVERY_FAILED sessionId={}, error={}", session.getSessionId(), ex.getMessage());
            }
        }
        log.debug("SESSION_BROADCAST recipients={}, candidates={}, excludeSessionId={}",
                recipients, targets.size(), excludeSessionId);
        return recipients;
    }

    public boolean sendTo(String sessionId, Map<String, Object> message) {
        Preconditions.checkNotNull(message, "message");
        StreamSession session;
        lock.lock();
        try {
            session = sessionId == null ? null : sessions.get(sessionId);
        } finally {
            lock.unlock();
        }
        if (session == null) {
            log.debug("SESSION_SEND_SKIPPED sessionId={}, reason=not_found", sessionId);
            return false;
        }
        boolean queued = session.enqueue(message);
        if (!queued) {
            log.debug("SESSION_SEND_SKIPPED sessionId={}, reason=closed", sessionId);
        }
        return queued;
    }

    public int sweepExpired() {
        return sweepExpired(clock.instant());
    }

    /**
     * 移除所有 {@code now - lastActive > sessionTimeout} 的会话。
     *
     * @return 移除数量
     */
    public int sweepExpired(Instant now) {
        List<StreamSession> expired = new ArrayList<>();
        lock.lock();
        try {
            for (StreamSession session : sessions.values()) {
                if (session.isIdleLongerThan(now, sessionTimeout)) {
                    expired.add(session);
                }
            }
            for (StreamSession session : expired) {
                removeLocked(session.getSessionId());
                session.close();
            }
        } finally {
            lock.unlock();
        }
        for (StreamSession session : expired) {
            log.info("SESSION_EXPIRED sessionId={}, userId={}, lastActive={}",
                    session.getSessionId(), session.getUserId(), session.getLastActive());
        }
        return expired.size();
    }

    public SessionRegistryStats stats() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int total = sessions.size();
            Map<String, Integer> perUser = new LinkedHashMap<>();
            for (Map.Entry<String, Set<String>> entry : userSessions.entrySet()) {
                perUser.put(entry.getKey(), entry.getValue().size());
            }
            double totalAgeSeconds = 0D;
            long queued = 0L;
            int initialized = 0;
            for (StreamSession session : sessions.values()) {
                totalAgeSeconds += Math.max(0L, Duration.between(session.getCreatedAt(), now).toMillis()) / 1000D;
                queued += session.queueSize();
                if (session.isInitialized()) {
                    initialized++;
                }
            }
            int users = userSessions.size();
            return new SessionRegistryStats(
                    total,
                    users,
                    Collections.unmodifiableMap(perUser),
                    users == 0 ? 0D : (double) total / users,
                    total == 0 ? 0D : totalAgeSeconds / total,
                    queued,
                    initialized,
                    total - initialized,
                    maxSessions,
                    sessionTimeout.getSeconds()
            );
        } finally {
            lock.unlock();
        }
    }

    public List<SessionSnapshot> list() {
        lock.lock();
        try {
            List<SessionSnapshot> snapshots = new ArrayList<>(sessions.size());
            for (StreamSession session : sessions.values()) {
                snapshots.add(SessionSnapshot.of(session));
            }
            return snapshots;
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    public List<String> getUserSessions(String userId) {
        lock.lock();
        try {
            Set<String> ids = userSessions.get(userId);
            return ids == null ? List.of() : List.copyOf(ids);
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getUserId(String sessionId) {
        lock.lock();
        try {
            StreamSession session = sessionId == null ? null : sessions.get(sessionId);
            return session == null ? Optional.empty() : Optional.of(session.getUserId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 移除全部会话，使所有推送连接的轮询尽快结束。
     */
    public void shutdown() {
        List<StreamSession> removed;
        lock.lock();
        try {
            removed = new ArrayList<>(sessions.values());
            sessions.clear();
            userSessions.clear();
            removed.forEach(StreamSession::close);
        } finally {
            lock.unlock();
        }
        log.info("SESSION_REGISTRY_SHUTDOWN removedSessions={}", removed.size());
    }

    private StreamSession evictOldestLocked() {
        StreamSession oldest = null;
        for (StreamSession session : sessions.values()) {
            if (oldest == null || session.getCreatedAt().isBefore(oldest.getCreatedAt())) {
                oldest = session;
            }
        }
        if (oldest == null) {
            return null;
        }
        removeLocked(oldest.getSessionId());
        oldest.close();
        return oldest;
    }

    private StreamSession removeLocked(String sessionId) {
        StreamSession session = sessions.remove(sessionId);
        if (session == null) {
            return null;
        }
        Set<String> ids = userSessions.get(session.getUserId());
        if (ids != null) {
            ids.remove(sessionId);
            if (ids.isEmpty()) {
                userSessions.remove(session.getUserId());
            }
        }
        return session;
    }

}
