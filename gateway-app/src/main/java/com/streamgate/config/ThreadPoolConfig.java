package com.streamgate.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * 推送读循环专用线程池与调度线程解耦，避免长连接阻塞心跳和清理任务。
 * </p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    /**
     * 推送读循环线程池；queue-capacity=0 时使用 SynchronousQueue，连接到来即开始推送。
     *
     * @param properties 线程池配置属性
     * @return 线程池执行器实例
     */
    @Bean(name = "streamDispatchExecutor")
    @ConditionalOnMissingBean(name = "streamDispatchExecutor")
    public ThreadPoolExecutor streamDispatchExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCoreSize(), 1);
        int maxSize = Math.max(properties.getMaxSize(), coreSize);
        long keepAliveSeconds = Math.max(properties.getKeepAliveSeconds(), 0L);
        int queueCapacity = Math.max(properties.getQueueCapacity(), 0);
        BlockingQueue<Runnable> queue = queueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(queueCapacity);
        String threadNamePrefix = properties.getThreadNamePrefix();
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                coreSize,
                maxSize,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(properties.getRejectionPolicy()));
        log.info("STREAM_DISPATCH_EXECUTOR_CREATED coreSize={}, maxSize={}, queueCapacity={}", coreSize, maxSize, queueCapacity);
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
