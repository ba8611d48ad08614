package com.streamgate.api.dto;

import lombok.Data;

/**
 * 限流重置响应 DTO。
 */
@Data
public class RateLimitResetResponseDTO {

    private String clientId;
    private Boolean reset;
}
