package com.demo.multisig.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProposalMetadata(
        String title,
        String description,
        OperationType type,
        String failureReason,
        Instant failedAt
) {
    public static ProposalMetadata empty() {
        return new ProposalMetadata(null, null, null, null, null);
    }

    public ProposalMetadata withFailure(String reason, Instant at) {
        return new ProposalMetadata(title, description, type, reason, at);
    }
}
