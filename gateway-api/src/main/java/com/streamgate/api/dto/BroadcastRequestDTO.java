package com.streamgate.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 广播请求 DTO。
 */
@Data
public class BroadcastRequestDTO {

    /** 广播正文 */
    private String message;

    /** 附加上下文，原样透传给客户端 */
    private Map<String, Object> context;

    /** 可选：不接收本次广播的会话 */
    private String excludeSessionId;
}
