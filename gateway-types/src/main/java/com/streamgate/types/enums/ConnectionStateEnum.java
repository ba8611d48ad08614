package com.streamgate.types.enums;

/**
 * 推送连接状态枚举：CONNECTING -> STREAMING -> CLOSED。
 */
public enum ConnectionStateEnum {
    CONNECTING,
    STREAMING,
    CLOSED
}
