package com.demo.multisig.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Resolves the connecting user from the {@code userId} query parameter or the
 * {@code X-User-Id} header; handshakes without one are refused.
 */
@Slf4j
@Component
public class UserHandshakeInterceptor implements HandshakeInterceptor {

    static final String USER_ATTRIBUTE = "userId";
    static final String USER_HEADER = "X-User-Id";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String userId = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().getFirst(USER_ATTRIBUTE);
        if (!StringUtils.hasText(userId)) {
            userId = request.getHeaders().getFirst(USER_HEADER);
        }
        if (!StringUtils.hasText(userId)) {
            log.warn("WebSocket handshake from {} without user id", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(USER_ATTRIBUTE, userId.trim());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }
}
