package com.demo.multisig.controller.dto;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.model.ProposalMetadata;
import com.demo.multisig.model.ProposalSignature;
import com.demo.multisig.model.SignatureMetadata;
import com.demo.multisig.model.ValidatorKind;
import com.demo.multisig.service.ErrorCode;
import com.demo.multisig.service.ProposalDraft;
import com.demo.multisig.service.SignCommand;
import com.demo.multisig.service.SignResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public final class ProposalDtos {

    private ProposalDtos() {}

    public static class CreateRequest {
        @NotBlank
        @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "must be a 0x-prefixed 20-byte address")
        public String to;
        @NotNull
        @DecimalMin("0")
        public BigDecimal value;
        public String data;
        @Min(1)
        public int requiredSignatures;
        @NotEmpty
        public List<String> validatorIds;
        public Long ttlSeconds;
        public ProposalMetadata metadata;

        public ProposalDraft toDraft() {
            return new ProposalDraft(to, value, data, requiredSignatures, validatorIds, ttlSeconds, metadata);
        }
    }

    public static class SignRequest {
        @NotBlank
        public String validatorId;
        @NotBlank
        public String signature;
        @NotNull
        public ValidatorKind signerType;
        @NotNull
        public Instant signedAt;
        public SignatureMetadata metadata;

        public SignCommand toCommand(String proposalId, String userId) {
            return new SignCommand(proposalId, validatorId, signature, signerType, signedAt, userId, metadata);
        }

        public ProposalSignature toSignature(String userId) {
            return new ProposalSignature(validatorId, signature, signerType, signedAt, userId, metadata);
        }
    }

    public static class PreflightRequest {
        @NotBlank
        public String proposalId;
        @Valid
        public List<SignRequest> signatures;
    }

    public static class SignResponse {
        public Proposal proposal;
        public boolean executed;
        public String transactionHash;   // may be null
        public ErrorCode errorCode;      // may be null
        public String error;             // may be null

        public static SignResponse from(SignResult r) {
            SignResponse out = new SignResponse();
            out.proposal = r.proposal();
            out.executed = r.executed();
            out.transactionHash = r.transactionHash();
            out.errorCode = r.errorCode();
            out.error = r.error();
            return out;
        }
    }
}
