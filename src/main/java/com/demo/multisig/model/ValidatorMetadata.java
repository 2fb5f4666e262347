package com.demo.multisig.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Kind-specific attributes of a validator. Each {@link ValidatorKind} has exactly
 * one metadata shape.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ValidatorMetadata.Social.class, name = "social"),
        @JsonSubTypes.Type(value = ValidatorMetadata.Passkey.class, name = "passkey"),
        @JsonSubTypes.Type(value = ValidatorMetadata.Hardware.class, name = "hardware")
})
public interface ValidatorMetadata {

    ValidatorKind kind();

    @JsonTypeName("social")
    record Social(String email, String provider, String publicAddress, String issuer) implements ValidatorMetadata {
        @Override
        public ValidatorKind kind() {
            return ValidatorKind.SOCIAL;
        }
    }

    @JsonTypeName("passkey")
    record Passkey(String credentialId, String authenticatorId, String passkeyName) implements ValidatorMetadata {
        @Override
        public ValidatorKind kind() {
            return ValidatorKind.PASSKEY;
        }
    }

    @JsonTypeName("hardware")
    record Hardware(String deviceModel, String publicAddress) implements ValidatorMetadata {
        @Override
        public ValidatorKind kind() {
            return ValidatorKind.HARDWARE;
        }
    }
}
