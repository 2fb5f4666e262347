package com.demo.multisig.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans proposal events out to every live connection of each recipient and,
 * independently, to the recipient's side channels. Live delivery is best effort
 * with no retry; devices recover missed events through resync.
 */
@Slf4j
@Service
public class NotificationService {

    private final NotificationHistory history;
    private final Map<ChannelType, SideChannelSender> senders = new EnumMap<>(ChannelType.class);
    private final Executor executor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int queueCapacity;

    private final Map<String, List<OutboundChannel>> connections = new ConcurrentHashMap<>();
    private final Map<String, Map<ChannelType, ChannelRegistration>> sideChannels = new ConcurrentHashMap<>();

    public NotificationService(NotificationHistory history,
                               List<SideChannelSender> senders,
                               @Qualifier("notificationExecutor") Executor executor,
                               ObjectMapper objectMapper,
                               Clock clock,
                               @Value("${multisig.notifications.outbound-queue-capacity:256}") int queueCapacity) {
        this.history = history;
        for (SideChannelSender s : senders) {
            this.senders.put(s.type(), s);
        }
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.queueCapacity = queueCapacity;
    }

    public void publish(NotificationMessage message) {
        String frame = encode(RealtimeFrame.NOTIFICATION, message);
        for (String recipient : message.recipients()) {
            history.record(recipient, message);
            deliverLive(recipient, frame);
            deliverSideChannels(recipient, message);
        }
        log.debug("Published {} to {} recipient(s)", message.id(), message.recipients().size());
    }

    /** Registers one device connection; a user may hold any number at once. */
    public OutboundChannel subscribe(String userId, LiveConnection connection) {
        OutboundChannel channel = new OutboundChannel(userId, connection, queueCapacity, executor,
                () -> unsubscribe(userId, connection.id()));
        connections.compute(userId, (k, list) -> {
            List<OutboundChannel> live = list == null ? new CopyOnWriteArrayList<>() : list;
            live.add(channel);
            return live;
        });
        log.info("Connection {} opened for user {}", connection.id(), userId);
        return channel;
    }

    /** Drops one connection; other connections of the same user are untouched. */
    public void unsubscribe(String userId, String connectionId) {
        connections.computeIfPresent(userId, (k, list) -> {
            list.removeIf(c -> c.id().equals(connectionId));
            return list.isEmpty() ? null : list;
        });
        log.info("Connection {} closed for user {}", connectionId, userId);
    }

    public List<OutboundChannel> connectionsOf(String userId) {
        return List.copyOf(connections.getOrDefault(userId, List.of()));
    }

    /** Replaces any earlier registration of the same channel type. */
    public void registerChannel(String userId, ChannelRegistration registration) {
        sideChannels.computeIfAbsent(userId, k -> new ConcurrentHashMap<>())
                .put(registration.type(), registration);
        log.info("Registered {} channel for user {}", registration.type().wire(), userId);
    }

    public Collection<ChannelRegistration> channelsOf(String userId) {
        return List.copyOf(sideChannels.getOrDefault(userId, Map.of()).values());
    }

    public List<HistoryEntry> recentNotifications(String userId, int limit) {
        return history.recent(userId, limit);
    }

    public boolean markAsRead(String userId, String notificationId) {
        return history.markAsRead(userId, notificationId);
    }

    /** Sends one frame to one connection, e.g. a reply to a client request. */
    public boolean sendTo(OutboundChannel channel, String type, Object data) {
        return channel.offer(encode(type, data));
    }

    /** Liveness check: pings every open connection and forgets closed ones. */
    @Scheduled(fixedDelayString = "${multisig.notifications.heartbeat-interval-ms:30000}")
    public void heartbeat() {
        String ping = encode(RealtimeFrame.PING, Map.of("timestamp", clock.millis()));
        connections.forEach((userId, list) -> {
            for (OutboundChannel c : list) {
                if (!c.isOpen() || !c.offer(ping)) {
                    unsubscribe(userId, c.id());
                }
            }
        });
    }

    private void deliverLive(String userId, String frame) {
        for (OutboundChannel c : connections.getOrDefault(userId, List.of())) {
            if (!c.offer(frame)) {
                unsubscribe(userId, c.id());
            }
        }
    }

    private void deliverSideChannels(String userId, NotificationMessage message) {
        for (ChannelRegistration reg : sideChannels.getOrDefault(userId, Map.of()).values()) {
            SideChannelSender sender = senders.get(reg.type());
            if (sender == null) continue;
            try {
                executor.execute(() -> {
                    try {
                        sender.send(reg, message);
                    } catch (RuntimeException e) {
                        log.warn("Error sending {} notification {} to user {}: {}",
                                reg.type().wire(), message.id(), userId, e.toString());
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("Notification executor saturated; {} delivery of {} skipped", reg.type().wire(), message.id());
            }
        }
    }

    String encode(String type, Object data) {
        try {
            return objectMapper.writeValueAsString(new RealtimeFrame(type, data, clock.instant()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + type + " frame", e);
        }
    }
}
