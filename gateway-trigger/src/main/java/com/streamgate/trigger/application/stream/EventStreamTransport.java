package com.streamgate.trigger.application.stream;

import java.io.IOException;

/**
 * 单条推送连接的写出端。
 */
public interface EventStreamTransport {

    /**
     * 写出一条事件；失败即视为该连接不可用。
     */
    void send(StreamEventFrame frame) throws IOException;

    /**
     * 对端是否仍在连接。
     */
    boolean isOpen();

    /**
     * 结束该连接，可重复调用。
     */
    void complete();

}
