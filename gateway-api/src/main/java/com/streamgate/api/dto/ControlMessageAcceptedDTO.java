package com.streamgate.api.dto;

import lombok.Data;

/**
 * 控制消息受理结果 DTO。
 */
@Data
public class ControlMessageAcceptedDTO {

    private String sessionId;
    private Boolean accepted;
    private Boolean initialized;
    private Double remainingTokens;
}
