package com.demo.multisig.repository;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.model.ProposalSignature;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable storage for proposals. Callers serialize writes per proposal id; the
 * store itself only guarantees one signature row per (proposal, validator).
 */
public interface ProposalRepository {

    void insert(Proposal proposal);

    Optional<Proposal> findById(String proposalId);

    /**
     * Proposals created by {@code userId} or naming any of {@code validatorIds} as an
     * eligible signer, newest first.
     */
    List<Proposal> findForUser(String userId, Set<String> validatorIds, ProposalQuery query);

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the validator already signed
     */
    void appendSignature(String proposalId, ProposalSignature signature, int position);

    /** Persists status, executedAt, transactionHash and metadata. */
    void updateResolution(Proposal proposal);

    List<String> findExpiredPendingIds(Instant now);
}
