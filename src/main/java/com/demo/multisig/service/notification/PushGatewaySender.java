package com.demo.multisig.service.notification;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

@Component
public class PushGatewaySender extends GatewayChannelSender {

    public PushGatewaySender(RestTemplate restTemplate, @Value("${notifications.push.baseUrl:}") String baseUrl) {
        super(restTemplate, baseUrl);
    }

    @Override
    public ChannelType type() {
        return ChannelType.PUSH;
    }

    @Override
    protected String path() {
        return "/push";
    }

    @Override
    protected Map<String, Object> body(ChannelRegistration reg, NotificationMessage m) {
        Map<String, Object> body = new HashMap<>();
        body.put("token", reg.endpoint());
        body.put("platform", reg.platform());
        body.put("title", m.title());
        body.put("body", m.message());
        body.put("collapseKey", m.data().proposalId());
        body.put("data", Map.of("type", m.type().wire(), "proposalId", m.data().proposalId()));
        return body;
    }
}
