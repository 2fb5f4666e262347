package com.demo.multisig.service.notification;

import java.time.Instant;
import java.util.Set;

public record NotificationMessage(
        String id,
        NotificationType type,
        String title,
        String message,
        NotificationPayload data,
        Instant timestamp,
        Set<String> recipients
) {
    public NotificationMessage {
        recipients = Set.copyOf(recipients);
        if (data.type() != type) {
            throw new IllegalArgumentException("Payload " + data.type() + " does not match " + type);
        }
    }
}
