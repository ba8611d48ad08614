/**
 * Admission 领域 - 准入与限流域
 *
 * <p>职责：按客户端身份做令牌桶限流，并根据客户端行为自适应调整容量</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>令牌桶：容量 capacity，按 capacity / window 每秒惰性补充</li>
 *   <li>准入判定：先补充再扣减，不足时拒绝且不改变令牌数</li>
 *   <li>自适应：成功率与请求间隔的指数移动平均决定容量倍数</li>
 *   <li>清理：长期未访问且接近满桶的客户端周期性移除</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>{@link com.streamgate.domain.admission.service.TokenBucketRateLimiter} - 基础令牌桶限流</li>
 *   <li>{@link com.streamgate.domain.admission.service.AdaptiveRateLimiter} - 自适应装饰器</li>
 * </ul>
 */
package com.streamgate.domain.admission;
