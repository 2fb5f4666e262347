package com.demo.multisig.service.notification;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Component
public class SmsGatewaySender extends GatewayChannelSender {

    // single SMS segment
    private static final int MAX_LENGTH = 160;

    public SmsGatewaySender(RestTemplate restTemplate, @Value("${notifications.sms.baseUrl:}") String baseUrl) {
        super(restTemplate, baseUrl);
    }

    @Override
    public ChannelType type() {
        return ChannelType.SMS;
    }

    @Override
    protected String path() {
        return "/sms";
    }

    @Override
    protected Map<String, Object> body(ChannelRegistration reg, NotificationMessage m) {
        String text = m.title() + ": " + m.message();
        if (text.length() > MAX_LENGTH) {
            text = text.substring(0, MAX_LENGTH - 3) + "...";
        }
        return Map.of("to", reg.endpoint(), "text", text);
    }
}
