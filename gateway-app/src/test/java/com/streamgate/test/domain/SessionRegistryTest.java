package com.streamgate.test.domain;

import com.streamgate.domain.session.model.entity.StreamSession;
import com.streamgate.domain.session.model.valobj.SessionRegistryStats;
import com.streamgate.domain.session.model.valobj.SessionSnapshot;
import com.streamgate.domain.session.service.SessionRegistry;
import com.streamgate.test.support.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

public class SessionRegistryTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private SessionRegistry registry;

    @BeforeEach
    public void setUp() {
        this.clock = new MutableClock(START);
        this.registry = new SessionRegistry(100, 60L, clock);
    }

    @Test
    public void shouldGenerateSessionIdWhenAbsent() {
        String generated = registry.create("user-1", null);
        String blank = registry.create("user-1", "  ");

        Assertions.assertNotNull(generated);
        Assertions.assertNotEquals(generated, blank);
        Assertions.assertEquals(2, registry.count());
        Assertions.assertEquals(List.of(generated, blank), registry.getUserSessions("user-1"));
    }

    @Test
    public void shouldRetouchExistingSessionOnCreate() {
        registry.create("user-1", "s1");
        clock.advanceSeconds(10L);

        String again = registry.create("user-1", "s1");

        SessionSnapshot snapshot = registry.find("s1").orElseThrow();
        Assertions.assertEquals("s1", again);
        Assertions.assertEquals(1, registry.count());
        Assertions.assertEquals(1L, snapshot.requestCount());
        Assertions.assertEquals(START.plusSeconds(10L), snapshot.lastActive());
        Assertions.assertEquals(START, snapshot.createdAt());
    }

    @Test
    public void shouldRejectBlankUserId() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.create(" ", "s1"));
    }

    @Test
    public void shouldEvictOldestWhenAtCapacity() {
        SessionRegistry small = new SessionRegistry(2, 60L, clock);
        small.create("user-1", "s1");
        clock.advanceSeconds(1L);
        small.create("user-2", "s2");
        clock.advanceSeconds(1L);
        small.get("s1");

        small.create("user-3", "s3");

        Assertions.assertEquals(2, small.count());
        Assertions.assertTrue(small.find("s1").isEmpty());
        Assertions.assertTrue(small.find("s2").isPresent());
        Assertions.assertTrue(small.find("s3").isPresent());
        Assertions.assertTrue(small.getUserSessions("user-1").isEmpty());
        Assertions.assertFalse(small.stats().sessionsPerUser().containsKey("user-1"));
    }

    @Test
    public void shouldKeepUserIndexConsistentAcrossRandomOperations() {
        SessionRegistry small = new SessionRegistry(8, 60L, clock);
        Random random = new Random(7L);
        for (int i = 0; i < 400; i++) {
            String sessionId = "s" + random.nextInt(12);
            String userId = "u" + random.nextInt(4);
            if (random.nextInt(3) == 0) {
                small.remove(sessionId);
            } else {
                small.create(userId, sessionId);
            }
            clock.advanceMillis(random.nextInt(500));
            assertIndexConsistent(small);
        }
    }

    @Test
    public void shouldSweepOnlySessionsIdleLongerThanTimeout() {
        registry.create("user-1", "idle");
        registry.create("user-2", "busy");
        clock.advanceSeconds(30L);
        registry.touch("busy");
        clock.advanceSeconds(30L);

        Assertions.assertEquals(0, registry.sweepExpired());

        clock.advanceSeconds(1L);
        Assertions.assertEquals(1, registry.sweepExpired());
        Assertions.assertTrue(registry.find("idle").isEmpty());
        Assertions.assertTrue(registry.find("busy").isPresent());
        Assertions.assertTrue(registry.getUserSessions("user-1").isEmpty());
    }

    @Test
    public void shouldBroadcastToAllButExcludedSession() {
        registry.create("user-1", "s1");
        registry.create("user-1", "s2");
        registry.create("user-2", "s3");

        int recipients = registry.broadcast(Map.of("type", "broadcast", "content", "hi"), "s2");

        Assertions.assertEquals(2, recipients);
        Assertions.assertEquals(1, registry.find("s1").orElseThrow().queueSize());
        Assertions.assertEquals(0, registry.find("s2").orElseThrow().queueSize());
        Assertions.assertEquals(1, registry.find("s3").orElseThrow().queueSize());
    }

    @Test
    public void shouldDrainAndCloseOnRemove() throws Exception {
        registry.create("user-1", "s1");
        StreamSession session = registry.get("s1").orElseThrow();
        registry.sendTo("s1", Map.of("type", "message"));
        registry.sendTo("s1", Map.of("type", "message"));

        Assertions.assertTrue(registry.remove("s1"));

        Assertions.assertTrue(session.isClosed());
        Assertions.assertEquals(0, session.queueSize());
        Assertions.assertNull(session.poll(10L, TimeUnit.MILLISECONDS));
        Assertions.assertFalse(registry.remove("s1"));
        Assertions.assertFalse(registry.sendTo("s1", Map.of("type", "message")));
        Assertions.assertTrue(registry.getUserId("s1").isEmpty());
        Assertions.assertFalse(session.enqueue(Map.of("type", "late")));
    }

    @Test
    public void shouldTouchOnGetButNotOnFind() {
        registry.create("user-1", "s1");
        clock.advanceSeconds(5L);

        registry.find("s1");
        Assertions.assertEquals(START, registry.find("s1").orElseThrow().lastActive());

        registry.get("s1");
        SessionSnapshot snapshot = registry.find("s1").orElseThrow();
        Assertions.assertEquals(START.plusSeconds(5L), snapshot.lastActive());
        Assertions.assertEquals(1L, snapshot.requestCount());
    }

    @Test
    public void shouldKeepLastActiveMonotonicWhenClockMovesBack() {
        registry.create("user-1", "s1");
        clock.advanceSeconds(10L);
        registry.touch("s1");
        clock.set(START.plusSeconds(3L));
        registry.touch("s1");

        Assertions.assertEquals(START.plusSeconds(10L), registry.find("s1").orElseThrow().lastActive());
    }

    @Test
    public void shouldManageMetadataAndInitializedFlag() {
        registry.create("user-1", "s1");

        Assertions.assertTrue(registry.setMetadata("s1", "clientName", "cli"));
        Assertions.assertEquals("cli", registry.getMetadata("s1", "clientName").orElseThrow());
        Assertions.assertTrue(registry.setMetadata("s1", "clientName", null));
        Assertions.assertTrue(registry.getMetadata("s1", "clientName").isEmpty());
        Assertions.assertFalse(registry.setMetadata("missing", "clientName", "cli"));

        Assertions.assertFalse(registry.find("s1").orElseThrow().initialized());
        Assertions.assertTrue(registry.markInitialized("s1"));
        Assertions.assertTrue(registry.find("s1").orElseThrow().initialized());
        Assertions.assertFalse(registry.markInitialized("missing"));
    }

    @Test
    public void shouldReportStats() {
        registry.create("user-1", "s1");
        registry.create("user-1", "s2");
        clock.advanceSeconds(10L);
        registry.create("user-2", "s3");
        registry.markInitialized("s3");
        registry.sendTo("s1", Map.of("type", "message"));

        SessionRegistryStats stats = registry.stats();

        Assertions.assertEquals(3, stats.totalSessions());
        Assertions.assertEquals(2, stats.totalUsers());
        Assertions.assertEquals(Map.of("user-1", 2, "user-2", 1), stats.sessionsPerUser());
        Assertions.assertEquals(1.5D, stats.averageSessionsPerUser(), 1e-9D);
        Assertions.assertEquals(20D / 3D, stats.averageSessionAgeSeconds(), 1e-9D);
        Assertions.assertEquals(1L, stats.totalQueuedMessages());
        Assertions.assertEquals(1, stats.initializedSessions());
        Assertions.assertEquals(2, stats.uninitializedSessions());
        Assertions.assertEquals(100, stats.maxSessions());
        Assertions.assertEquals(60L, stats.sessionTimeoutSeconds());
    }

    @Test
    public void shouldRemoveEverySessionOnShutdown() {
        registry.create("user-1", "s1");
        registry.create("user-2", "s2");
        StreamSession session = registry.get("s2").orElseThrow();

        registry.shutdown();

        Assertions.assertEquals(0, registry.count());
        Assertions.assertTrue(session.isClosed());
        Assertions.assertTrue(registry.list().isEmpty());
    }

    private void assertIndexConsistent(SessionRegistry target) {
        List<SessionSnapshot> sessions = target.list();
        SessionRegistryStats stats = target.stats();
        int indexed = 0;
        for (Map.Entry<String, Integer> entry : stats.sessionsPerUser().entrySet()) {
            Assertions.assertTrue(entry.getValue() > 0, "empty user entry " + entry.getKey());
            indexed += entry.getValue();
        }
        Assertions.assertEquals(sessions.size(), indexed);
        Assertions.assertTrue(sessions.size() <= target.getMaxSessions());
        List<String> seen = new ArrayList<>();
        for (SessionSnapshot snapshot : sessions) {
            Assertions.assertTrue(target.getUserSessions(snapshot.userId()).contains(snapshot.sessionId()));
            Assertions.assertFalse(seen.contains(snapshot.sessionId()));
            seen.add(snapshot.sessionId());
        }
    }
}
