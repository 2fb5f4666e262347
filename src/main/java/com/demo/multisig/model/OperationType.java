package com.demo.multisig.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OperationType {
    TRANSFER("transfer"),
    CONTRACT_INTERACTION("contract_interaction"),
    NFT_TRANSFER("nft_transfer"),
    TOKEN_APPROVAL("token_approval");

    private final String wire;

    OperationType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static OperationType fromWire(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (OperationType t : values()) {
            if (t.wire.equals(v)) return t;
        }
        throw new IllegalArgumentException("Unknown operation type: " + value);
    }
}
