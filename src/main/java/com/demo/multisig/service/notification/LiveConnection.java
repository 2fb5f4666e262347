package com.demo.multisig.service.notification;

import java.io.IOException;

/** Transport of one connected device, e.g. a WebSocket session. */
public interface LiveConnection {

    String id();

    boolean isOpen();

    void send(String frame) throws IOException;

    void close();
}
