package com.demo.multisig.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValidatorKind {
    SOCIAL("social"),
    PASSKEY("passkey"),
    HARDWARE("hardware");

    private final String wire;

    ValidatorKind(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ValidatorKind fromWire(String value) {
        if (value == null) return null;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ValidatorKind k : values()) {
            if (k.wire.equals(v)) return k;
        }
        throw new IllegalArgumentException("Unknown validator kind: " + value);
    }

    /** Numeric tag used in the ABI-encoded aggregate. */
    public int abiTag() {
        return ordinal();
    }
}
