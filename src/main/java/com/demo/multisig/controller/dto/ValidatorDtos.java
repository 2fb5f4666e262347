package com.demo.multisig.controller.dto;

import com.demo.multisig.model.SigningPolicy;
import com.demo.multisig.model.Validator;
import com.demo.multisig.model.ValidatorKind;
import com.demo.multisig.model.ValidatorMetadata;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public final class ValidatorDtos {

    private ValidatorDtos() {}

    public static class AddRequest {
        public String id;          // generated when absent
        @NotNull
        public ValidatorKind kind;
        @NotBlank
        public String name;
        public String publicKey;
        public ValidatorMetadata metadata;

        public Validator toValidator() {
            return Validator.builder()
                    .id(id)
                    .kind(kind)
                    .name(name)
                    .publicKey(publicKey)
                    .metadata(metadata)
                    .build();
        }
    }

    public static class PolicyRequest {
        public boolean requireMultiSig;
        @Min(1)
        public int threshold;
        @DecimalMin("0")
        public BigDecimal highValueThreshold;

        public SigningPolicy toPolicy() {
            return new SigningPolicy(requireMultiSig, threshold, highValueThreshold);
        }
    }
}
