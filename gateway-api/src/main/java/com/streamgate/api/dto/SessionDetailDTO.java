package com.streamgate.api.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.Map;

/**
 * 会话详情 DTO。
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class SessionDetailDTO extends SessionSummaryDTO {

    private Long ageSeconds;
    private Long idleSeconds;
    private Boolean connected;
    private Map<String, Object> metadata;
}
