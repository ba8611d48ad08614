package com.streamgate.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 网关整体运行统计 DTO。
 */
@Data
public class GatewayStatsDTO {

    private Map<String, Object> sessions;
    private Map<String, Object> rateLimits;
    private Integer activeConnections;
    private String generatedAt;
}
