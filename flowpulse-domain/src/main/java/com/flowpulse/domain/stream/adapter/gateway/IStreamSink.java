package com.flowpulse.domain.stream.adapter.gateway;

import com.flowpulse.domain.stream.model.valobj.StreamMessage;

import java.io.IOException;

/**
 * 单个客户端连接的输出端。
 */
public interface IStreamSink {

    /**
     * 写出一条消息，写失败抛出 IOException。
     */
    void send(StreamMessage message) throws IOException;

    /**
     * 关闭连接，可重复调用。
     */
    void close();
}
