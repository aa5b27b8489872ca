package com.flowpulse.domain.stream.model.entity;

import com.flowpulse.domain.stream.adapter.gateway.IStreamSink;
import com.flowpulse.domain.stream.model.valobj.StreamMessage;
import lombok.Getter;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * 运行时客户端连接。
 * <p>
 * 同一连接上的写操作串行执行；关闭后所有写入直接失败。
 * </p>
 */
@Getter
public class ClientConnectionEntity {

    private final String clientId;
    private final Set<String> channels;
    private final IStreamSink sink;
    private final Instant connectedAt;
    private volatile Instant lastSeenAt;
    private volatile ScheduledFuture<?> heartbeatTask;
    private volatile boolean closed;

    public ClientConnectionEntity(String clientId, Collection<String> channels, IStreamSink sink, Instant connectedAt) {
        if (clientId == null || clientId.trim().isEmpty()) {
            throw new IllegalArgumentException("clientId cannot be empty");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.clientId = clientId.trim();
        this.channels = Collections.unmodifiableSet(channels == null ? new LinkedHashSet<>() : new LinkedHashSet<>(channels));
        this.sink = sink;
        this.connectedAt = connectedAt;
        this.lastSeenAt = connectedAt;
    }

    public boolean subscribesToAny(Collection<String> targetChannels) {
        if (targetChannels == null || targetChannels.isEmpty()) {
            return false;
        }
        for (String channel : targetChannels) {
            if (channel != null && channels.contains(channel)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 写出消息，成功后刷新 lastSeenAt。连接已关闭时同样抛出 IOException。
     */
    public void send(StreamMessage message, Instant now) throws IOException {
        synchronized (this) {
            if (closed) {
                throw new IOException("Connection already closed: " + clientId);
            }
            sink.send(message);
            lastSeenAt = now;
        }
    }

    /**
     * 绑定心跳任务；连接已关闭时立即取消该任务。
     */
    public void attachHeartbeat(ScheduledFuture<?> task) {
        synchronized (this) {
            if (!closed) {
                this.heartbeatTask = task;
                return;
            }
        }
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * 取消心跳并关闭输出端。
     *
     * @return 首次关闭返回 true
     */
    public boolean close() {
        ScheduledFuture<?> task;
        synchronized (this) {
            if (closed) {
                return false;
            }
            closed = true;
            task = heartbeatTask;
        }
        if (task != null) {
            task.cancel(false);
        }
        sink.close();
        return true;
    }
}
