package com.demo.multisig.service.notification;

import java.time.Instant;

/** Envelope of every message on the real-time stream, in both directions. */
public record RealtimeFrame(String type, Object data, Instant timestamp) {

    public static final String CONNECTION_ESTABLISHED = "connection_established";
    public static final String NOTIFICATION = "notification";
    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String SUBSCRIBED = "subscribed";
    public static final String SYNC_DATA = "sync_data";
    public static final String DEVICE_REGISTERED = "device_registered";
    public static final String ERROR = "error";
}
