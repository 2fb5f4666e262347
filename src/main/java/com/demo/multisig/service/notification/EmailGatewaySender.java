package com.demo.multisig.service.notification;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Component
public class EmailGatewaySender extends GatewayChannelSender {

    public EmailGatewaySender(RestTemplate restTemplate, @Value("${notifications.email.baseUrl:}") String baseUrl) {
        super(restTemplate, baseUrl);
    }

    @Override
    public ChannelType type() {
        return ChannelType.EMAIL;
    }

    @Override
    protected String path() {
        return "/email";
    }

    @Override
    protected Map<String, Object> body(ChannelRegistration reg, NotificationMessage m) {
        return Map.of(
                "to", reg.endpoint(),
                "subject", m.title(),
                "text", m.message() + "\n\nProposal: " + m.data().proposalId());
    }
}
