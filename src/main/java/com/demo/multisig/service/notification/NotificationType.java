package com.demo.multisig.service.notification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    NEW_PROPOSAL("new_proposal"),
    SIGNATURE_ADDED("signature_added"),
    PROPOSAL_EXECUTED("proposal_executed"),
    PROPOSAL_CANCELLED("proposal_cancelled"),
    PROPOSAL_EXPIRED("proposal_expired");

    private final String wire;

    NotificationType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
