package com.streamgate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 推送读循环线程池配置属性，前缀 executor.stream。
 * <p>
 * 每条推送连接在其生命周期内独占一个线程，maxSize 应不小于 gateway.session.max-sessions。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "executor.stream", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认16 */
    private Integer coreSize = 16;

    /** 最大线程数，默认256 */
    private Integer maxSize = 256;

    /** 空闲线程最大存活时间（秒），默认60 */
    private Long keepAliveSeconds = 60L;

    /** 队列容量，默认0（直接移交，满员时拒绝新连接） */
    private Integer queueCapacity = 0;

    /**
     * 拒绝策略，默认AbortPolicy。
     * <ul>
     *   <li>AbortPolicy：抛出RejectedExecutionException，连接立即关闭</li>
     *   <li>DiscardPolicy：直接丢弃任务，不抛出异常</li>
     *   <li>DiscardOldestPolicy：将最早进入队列的任务删除，之后再尝试加入队列</li>
     *   <li>CallerRunsPolicy：由调用线程执行该任务</li>
     * </ul>
     */
    private String rejectionPolicy = "AbortPolicy";

    /** 线程名前缀 */
    private String threadNamePrefix = "stream-dispatch-";

}
