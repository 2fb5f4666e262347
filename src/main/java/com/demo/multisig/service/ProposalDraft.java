package com.demo.multisig.service;

import com.demo.multisig.model.ProposalMetadata;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input of {@link ProposalService#create}. A null {@code ttlSeconds} falls back to
 * the configured default.
 */
public record ProposalDraft(
        String to,
        BigDecimal value,
        String data,
        int requiredSignatures,
        List<String> validatorIds,
        Long ttlSeconds,
        ProposalMetadata metadata
) {
}
