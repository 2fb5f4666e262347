package com.demo.multisig.service.notification;

import com.demo.multisig.model.DeviceInfo;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded outbound queue in front of one {@link LiveConnection}. Producers never
 * block: a full queue drops its oldest frame. At most one drain task per channel
 * runs at a time, so frames reach the connection in enqueue order.
 */
@Slf4j
public class OutboundChannel {

    private final String userId;
    private final LiveConnection connection;
    private final BlockingDeque<String> queue;
    private final Executor executor;
    private final Runnable onFailure;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile DeviceInfo device;

    OutboundChannel(String userId, LiveConnection connection, int capacity, Executor executor, Runnable onFailure) {
        this.userId = userId;
        this.connection = connection;
        this.queue = new LinkedBlockingDeque<>(Math.max(1, capacity));
        this.executor = executor;
        this.onFailure = onFailure;
        this.device = DeviceInfo.unknown(connection.id());
    }

    public String id() {
        return connection.id();
    }

    public String userId() {
        return userId;
    }

    public DeviceInfo device() {
        return device;
    }

    public void attach(DeviceInfo info) {
        this.device = info;
    }

    public boolean isOpen() {
        return connection.isOpen();
    }

    public boolean offer(String frame) {
        if (!connection.isOpen()) return false;
        while (!queue.offerLast(frame)) {
            if (queue.pollFirst() != null) {
                log.warn("Outbound queue full for connection {} of user {}; dropped oldest frame", id(), userId);
            }
        }
        scheduleDrain();
        return true;
    }

    int queued() {
        return queue.size();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                // frames stay queued; the next offer retries the drain
                draining.set(false);
                log.warn("Drain of connection {} of user {} rejected; {} frame(s) left queued",
                        id(), userId, queue.size());
            }
        }
    }

    private void drain() {
        try {
            String frame;
            while ((frame = queue.pollFirst()) != null) {
                if (!write(frame)) {
                    queue.clear();
                    return;
                }
            }
        } finally {
            draining.set(false);
        }
        if (!queue.isEmpty() && connection.isOpen()) {
            scheduleDrain();
        }
    }

    private boolean write(String frame) {
        try {
            connection.send(frame);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Send failed on connection {} of user {}: {}", id(), userId, e.toString());
            connection.close();
            onFailure.run();
            return false;
        }
    }
}
