package com.streamgate.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 单个客户端限流状态 DTO。
 * <p>
 * {@code tracked=false} 表示该客户端当前没有令牌桶（从未访问或已被清理），
 * 此时 remainingTokens 为满桶容量。
 * </p>
 */
@Data
public class RateLimitStatusDTO {

    private String clientId;
    private Boolean tracked;
    private Double remainingTokens;
    private Double timeUntilNextToken;
    private Map<String, Object> stats;
}
