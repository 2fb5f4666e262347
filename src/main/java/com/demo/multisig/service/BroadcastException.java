package com.demo.multisig.service;

/** The execution layer refused or failed to accept a transaction. */
public class BroadcastException extends Exception {

    public BroadcastException(String message) {
        super(message);
    }

    public BroadcastException(String message, Throwable cause) {
        super(message, cause);
    }
}
