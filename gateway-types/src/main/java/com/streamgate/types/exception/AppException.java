package com.streamgate.types.exception;

import com.streamgate.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 网关业务异常基类，携带信封响应码。
 * <p>
 * 由 HTTP 层统一转换为 {@code Response}；子类可决定 HTTP 状态（429 / 404）。
 * </p>
 */
@Getter
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    private final String code;

    private final String info;

    public AppException(ResponseCode responseCode) {
        this(responseCode.getCode(), responseCode.getInfo());
    }

    public AppException(ResponseCode responseCode, String info) {
        this(responseCode.getCode(), info);
    }

    public AppException(String code, String info) {
        super(info);
        this.code = code;
        this.info = info;
    }

    public AppException(String code, String info, Throwable cause) {
        super(info, cause);
        this.code = code;
        this.info = info;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code='" + code + "', info='" + info + "'}";
    }

}
