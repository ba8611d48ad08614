package com.streamgate.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义流式网关中跨模块共享的请求头、事件名与消息字段。
 * </p>
 */
public class Constants {

    /** 逗号分隔符，用于解析 X-Forwarded-For 等多值请求头 */
    public final static String SPLIT = ",";

    /** 响应头：本次连接绑定的会话 ID */
    public final static String HEADER_SESSION_ID = "X-Session-Id";

    /** 请求头：客户端 API Key，存在时作为限流身份 */
    public final static String HEADER_API_KEY = "X-Api-Key";

    /** 请求头：反向代理转发的客户端地址 */
    public final static String HEADER_FORWARDED_FOR = "X-Forwarded-For";

    /** 消息字段：事件类型 */
    public final static String FIELD_TYPE = "type";

    /** 消息字段：显式事件名，优先于 type */
    public final static String FIELD_EVENT = "event";

    /** 消息字段：事件 ID */
    public final static String FIELD_ID = "id";

    /** 消息字段：时间戳（ISO-8601） */
    public final static String FIELD_TIMESTAMP = "timestamp";

    /** 消息字段：控制消息方法名 */
    public final static String FIELD_METHOD = "method";

    /** 保留事件类型：心跳 */
    public final static String EVENT_HEARTBEAT = "heartbeat";

    /** 保留事件类型：连接建立 */
    public final static String EVENT_CONNECTION = "connection";

    /** 保留事件类型：广播 */
    public final static String EVENT_BROADCAST = "broadcast";

    /** 默认事件名 */
    public final static String EVENT_DEFAULT = "message";

}
