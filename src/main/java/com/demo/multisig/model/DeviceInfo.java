package com.demo.multisig.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Set;

/** A connected client. Used for fanout targeting and display only. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceInfo(String deviceId, String deviceName, Set<String> capabilities, String platform, String userAgent) {

    public DeviceInfo {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public static DeviceInfo unknown(String connectionId) {
        return new DeviceInfo(connectionId, null, Set.of(), null, null);
    }
}
