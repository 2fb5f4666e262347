package com.demo.multisig.service.notification;

public record HistoryEntry(NotificationMessage notification, boolean read) {

    HistoryEntry markRead() {
        return read ? this : new HistoryEntry(notification, true);
    }
}
