package com.demo.multisig.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Proposal lifecycle. Only {@link #PENDING} has outgoing transitions; every
 * other state is terminal.
 */
public enum ProposalStatus {
    PENDING("pending"),
    EXECUTED("executed"),
    CANCELLED("cancelled"),
    EXPIRED("expired"),
    FAILED("failed");

    private final String wire;

    ProposalStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ProposalStatus fromWire(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ProposalStatus s : values()) {
            if (s.wire.equals(v)) return s;
        }
        throw new IllegalArgumentException("Unknown proposal status: " + value);
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(ProposalStatus next) {
        return this == PENDING && next != null && next != PENDING;
    }
}
