package com.streamgate.api.dto;

import lombok.Data;

/**
 * 强制断开会话响应 DTO。
 */
@Data
public class SessionDisconnectResponseDTO {

    private String sessionId;
    private Boolean disconnected;
}
