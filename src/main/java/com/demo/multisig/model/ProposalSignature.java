package com.demo.multisig.model;

import java.time.Instant;

public record ProposalSignature(
        String validatorId,
        String signature,
        ValidatorKind signerType,
        Instant signedAt,
        String signedBy,
        SignatureMetadata metadata
) {
}
