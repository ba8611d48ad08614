package com.streamgate.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义网关所有 API 响应的响应码和对应描述信息。
 * 远端客户端能直接观察到的错误只有限流与会话不存在两类。
 * </p>
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 会话不存在 */
    SESSION_NOT_FOUND("0404", "会话不存在"),

    /** 请求过于频繁 */
    RATE_LIMITED("0429", "请求过于频繁，请稍后重试");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
