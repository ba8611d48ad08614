package com.streamgate.domain.session.model.valobj;

import java.util.Map;

/**
 * 会话表统计值对象。
 */
public record SessionRegistryStats(int totalSessions,
                                   int totalUsers,
                                   Map<String, Integer> sessionsPerUser,
                                   double averageSessionsPerUser,
                                   double averageSessionAgeSeconds,
                                   long totalQueuedMessages,
                                   int initializedSessions,
                                   int uninitializedSessions,
                                   int maxSessions,
                                   long sessionTimeoutSeconds) {
}
