package com.streamgate.trigger.application.stream;

/**
 * 一条待写出的推送事件。
 *
 * @param id      事件 ID，心跳为 null
 * @param event   事件名
 * @param data    JSON 编码后的消息体
 * @param retryMs 客户端重连间隔
 */
public record StreamEventFrame(String id, String event, String data, long retryMs) {
}
