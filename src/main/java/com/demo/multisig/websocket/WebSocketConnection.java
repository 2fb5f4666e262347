package com.demo.multisig.websocket;

import com.demo.multisig.service.notification.LiveConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/** Adapts a Spring {@link WebSocketSession}; only the channel's drain task calls {@link #send}. */
@Slf4j
class WebSocketConnection implements LiveConnection {

    private final WebSocketSession session;

    WebSocketConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close of session {} failed: {}", session.getId(), e.toString());
        }
    }
}
