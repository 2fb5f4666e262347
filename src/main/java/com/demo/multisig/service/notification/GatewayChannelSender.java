package com.demo.multisig.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.Map;

/**
 * Delivers through an HTTP gateway (push service, mail relay, SMS provider). A
 * blank base URL disables the channel.
 */
@Slf4j
abstract class GatewayChannelSender implements SideChannelSender {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    GatewayChannelSender(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl == null ? "" : (baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl);
    }

    @Override
    public void send(ChannelRegistration registration, NotificationMessage message) {
        if (baseUrl.isBlank()) {
            log.debug("{} gateway not configured; skip {}", type().wire(), message.id());
            return;
        }
        var req = RequestEntity
                .post(URI.create(baseUrl + path()))
                .contentType(MediaType.APPLICATION_JSON)
                .body(body(registration, message));
        restTemplate.exchange(req, Map.class);
        log.debug("{} notification {} sent to {}", type().wire(), message.id(), registration.endpoint());
    }

    protected abstract String path();

    protected abstract Map<String, Object> body(ChannelRegistration registration, NotificationMessage message);
}
