package com.streamgate.types.exception;

import com.streamgate.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 会话不存在异常，仅在 HTTP 边界抛出；领域层以 boolean / Optional 表达未命中。
 */
@Getter
public class SessionNotFoundException extends AppException {

    private static final long serialVersionUID = 4120957383321174012L;

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ResponseCode.SESSION_NOT_FOUND, ResponseCode.SESSION_NOT_FOUND.getInfo() + ": " + sessionId);
        this.sessionId = sessionId;
    }
}
