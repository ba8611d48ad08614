package com.streamgate.api.dto;

import lombok.Data;

/**
 * 广播响应 DTO。
 */
@Data
public class BroadcastResponseDTO {

    private Integer recipients;
}
