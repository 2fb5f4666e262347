package com.demo.multisig.service;

import com.demo.multisig.model.SignatureMetadata;
import com.demo.multisig.model.ValidatorKind;

import java.time.Instant;

/**
 * One validator's signature submission. {@code signedBy} is the authenticated
 * caller and must own the validator.
 */
public record SignCommand(
        String proposalId,
        String validatorId,
        String signature,
        ValidatorKind signerType,
        Instant signedAt,
        String signedBy,
        SignatureMetadata metadata
) {
}
