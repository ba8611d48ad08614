package com.streamgate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 网关会话与限流配置属性，前缀 gateway。
 * <p>
 * 推送流相关参数（gateway.stream.*）由各组件通过 {@code @Value} 直接读取。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "gateway", ignoreInvalidFields = true)
public class GatewayProperties {

    private Session session = new Session();

    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Session {

        /** 最大并发会话数，默认100 */
        private Integer maxSessions = 100;

        /** 会话空闲超时（秒），默认3600 */
        private Long sessionTimeoutSeconds = 3600L;

        /** 过期清理周期（秒），默认60 */
        private Long cleanupIntervalSeconds = 60L;

        /** 未提供 user_id 时使用的用户 */
        private String defaultUserId = "default_user";
    }

    @Data
    public static class RateLimit {

        /** 窗口内允许的请求数，默认100 */
        private Integer requests = 100;

        /** 窗口大小（秒），默认60 */
        private Long windowSeconds = 60L;

        private Adaptive adaptive = new Adaptive();
    }

    @Data
    public static class Adaptive {

        /** 是否启用自适应限流，默认开启 */
        private Boolean enabled = true;

        /** 最小容量倍数，默认0.5 */
        private Double minMultiplier = 0.5D;

        /** 最大容量倍数，默认2.0 */
        private Double maxMultiplier = 2.0D;
    }

}
