package com.demo.multisig.websocket;

import com.demo.multisig.model.DeviceInfo;
import com.demo.multisig.service.ResyncService;
import com.demo.multisig.service.notification.NotificationService;
import com.demo.multisig.service.notification.OutboundChannel;
import com.demo.multisig.service.notification.RealtimeFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;
import java.util.Map;

/**
 * Real-time event stream. Each session becomes one {@link OutboundChannel}; every
 * reply goes through that channel so writes to a session never interleave.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationSocketHandler extends TextWebSocketHandler {

    private static final String CHANNEL_ATTRIBUTE = "outboundChannel";

    private final NotificationService notifications;
    private final ResyncService resyncService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String userId = userId(session);
        OutboundChannel channel = notifications.subscribe(userId, new WebSocketConnection(session));
        session.getAttributes().put(CHANNEL_ATTRIBUTE, channel);
        notifications.sendTo(channel, RealtimeFrame.CONNECTION_ESTABLISHED, Map.of(
                "connectionId", channel.id(),
                "userId", userId,
                "serverTime", clock.millis()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        OutboundChannel channel = (OutboundChannel) session.getAttributes().get(CHANNEL_ATTRIBUTE);
        if (channel == null) return;

        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            notifications.sendTo(channel, RealtimeFrame.ERROR, Map.of("message", "Malformed frame"));
            return;
        }
        String type = frame.path("type").asText("");
        JsonNode data = frame.path("data");
        String userId = channel.userId();

        switch (type) {
            case "ping" -> notifications.sendTo(channel, RealtimeFrame.PONG, Map.of("timestamp", clock.millis()));
            case "pong" -> log.trace("Heartbeat reply on {}", channel.id());
            case "subscribe_proposals" -> notifications.sendTo(channel, RealtimeFrame.SUBSCRIBED,
                    Map.of("userId", userId, "channel", "proposals"));
            case "request_sync" -> notifications.sendTo(channel, RealtimeFrame.SYNC_DATA, resyncService.resync(userId));
            case "device_info" -> registerDevice(channel, data);
            default -> notifications.sendTo(channel, RealtimeFrame.ERROR,
                    Map.of("message", "Unknown message type: " + type));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.toString());
        notifications.unsubscribe(userId(session), session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        notifications.unsubscribe(userId(session), session.getId());
    }

    private void registerDevice(OutboundChannel channel, JsonNode data) {
        DeviceInfo info;
        try {
            info = objectMapper.treeToValue(data, DeviceInfo.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            notifications.sendTo(channel, RealtimeFrame.ERROR, Map.of("message", "Invalid device_info"));
            return;
        }
        if (info == null || info.deviceId() == null) {
            info = DeviceInfo.unknown(channel.id());
        }
        channel.attach(info);
        log.info("Device {} ({}) registered on connection {}", info.deviceId(), info.platform(), channel.id());
        notifications.sendTo(channel, RealtimeFrame.DEVICE_REGISTERED, Map.of("deviceId", info.deviceId()));
    }

    private static String userId(WebSocketSession session) {
        return (String) session.getAttributes().get(UserHandshakeInterceptor.USER_ATTRIBUTE);
    }
}
