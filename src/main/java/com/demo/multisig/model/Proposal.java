package com.demo.multisig.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Authorization request for one outbound call. Instances are immutable; every
 * mutation returns a copy, and status changes go through {@link #transitionTo}.
 * The signature list keeps arrival order and is the only source of the collected
 * count.
 */
@Value
@Builder(toBuilder = true)
public class Proposal {
    String id;
    String createdBy;
    String to;
    BigDecimal value;
    String data;
    int requiredSignatures;
    List<String> validatorIds;
    List<ProposalSignature> signatures;
    ProposalStatus status;
    Instant createdAt;
    Instant expiresAt;
    Instant executedAt;
    String transactionHash;
    ProposalMetadata metadata;

    public int getCollectedSignatures() {
        return signatures == null ? 0 : signatures.size();
    }

    public int getRemainingSignatures() {
        return Math.max(0, requiredSignatures - getCollectedSignatures());
    }

    public boolean isEligible(String validatorId) {
        return validatorIds != null && validatorIds.contains(validatorId);
    }

    public boolean hasSignatureFrom(String validatorId) {
        return signatures != null && signatures.stream().anyMatch(s -> s.validatorId().equals(validatorId));
    }

    public boolean quorumReached() {
        return getCollectedSignatures() >= requiredSignatures;
    }

    public boolean expiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public Proposal withSignature(ProposalSignature signature) {
        List<ProposalSignature> next = new ArrayList<>(signatures == null ? List.of() : signatures);
        next.add(signature);
        return toBuilder().signatures(List.copyOf(next)).build();
    }

    public Proposal transitionTo(ProposalStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + status.wire() + " -> " + next.wire());
        }
        return toBuilder().status(next).build();
    }

    public Proposal executed(String txHash, Instant at) {
        return transitionTo(ProposalStatus.EXECUTED).toBuilder()
                .transactionHash(txHash)
                .executedAt(at)
                .build();
    }

    public Proposal failed(String reason, Instant at) {
        ProposalMetadata md = metadata == null ? ProposalMetadata.empty() : metadata;
        return transitionTo(ProposalStatus.FAILED).toBuilder()
                .metadata(md.withFailure(reason, at))
                .build();
    }
}
