package com.streamgate.api.dto;

import lombok.Data;

/**
 * 会话列表项 DTO，时间字段为 ISO-8601 字符串。
 */
@Data
public class SessionSummaryDTO {

    private String sessionId;
    private String userId;
    private String clientAddress;
    private String createdAt;
    private String lastActive;
    private Long requestCount;
    private Boolean initialized;
    private Integer queueSize;
}
