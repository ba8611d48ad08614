package com.streamgate.types.exception;

import com.streamgate.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 限流拒绝异常，携带建议的重试等待时间（秒）。
 */
@Getter
public class RateLimitedException extends AppException {

    private static final long serialVersionUID = -2286512380459213474L;

    private final String clientId;
    private final double retryAfterSeconds;

    public RateLimitedException(String clientId, double retryAfterSeconds) {
        super(ResponseCode.RATE_LIMITED);
        this.clientId = clientId;
        this.retryAfterSeconds = Math.max(retryAfterSeconds, 0D);
    }

    /**
     * Retry-After 头只接受整秒，向上取整且至少为 1。
     */
    public long getRetryAfterHeaderSeconds() {
        return Math.max(1L, (long) Math.ceil(retryAfterSeconds));
    }
}
