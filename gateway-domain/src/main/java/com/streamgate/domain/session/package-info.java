/**
 * Session 领域 - 推送会话管理域
 *
 * <p>职责：维护进程内的推送会话表、用户索引与出站消息队列</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>会话：一条推送通道绑定的 (userId, sessionId) 身份，持有 FIFO 出站队列</li>
 *   <li>用户索引：userId 到其会话集合，与会话主表始终一致</li>
 *   <li>过期清理：lastActive 超过 sessionTimeout 的会话被移除</li>
 *   <li>容量淘汰：达到 maxSessions 时淘汰 createdAt 最早的会话</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.streamgate.domain.session.model.entity.StreamSession}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>{@link com.streamgate.domain.session.service.SessionRegistry} - 会话生命周期与投递</li>
 * </ul>
 */
package com.streamgate.domain.session;
