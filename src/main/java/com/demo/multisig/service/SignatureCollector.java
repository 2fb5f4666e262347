package com.demo.multisig.service;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.model.ProposalSignature;
import com.demo.multisig.model.ProposalStatus;
import com.demo.multisig.model.Validator;
import com.demo.multisig.repository.ProposalRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Validates and appends validator signatures. Preconditions are checked in a
 * fixed order, each with its own {@link ErrorCode}, inside the proposal's lock
 * together with the append. The quorum check runs before returning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignatureCollector {

    private final ProposalRepository proposalRepository;
    private final ProposalService proposalService;
    private final ValidatorRegistry registry;
    private final SignatureVerifier verifier;
    private final FreshnessWindow freshness;
    private final ExecutionCoordinator coordinator;
    private final KeyedLocks locks;
    private final ProposalEvents events;
    private final Clock clock;

    public SignResult sign(SignCommand cmd) {
        String proposalId = cmd.proposalId();
        Attempt attempt = locks.withLock(ProposalService.lockKey(proposalId), () -> attempt(cmd));

        if (attempt.expired() != null) {
            events.expired(attempt.expired());
            throw new MultiSigException(ErrorCode.EXPIRED, "Proposal " + proposalId + " has expired");
        }
        events.signatureAdded(attempt.signed(), cmd.validatorId());

        ExecutionResult execution = coordinator.tryExecute(proposalId);
        return SignResult.of(proposalService.get(proposalId), execution);
    }

    private Attempt attempt(SignCommand cmd) {
        Proposal p = proposalService.get(cmd.proposalId());
        String validatorId = cmd.validatorId();
        // ineligible signers are rejected whatever the status
        if (!p.isEligible(validatorId)) {
            throw new MultiSigException(ErrorCode.UNAUTHORIZED,
                    "Validator " + validatorId + " is not authorized for this proposal");
        }
        if (p.getStatus() != ProposalStatus.PENDING) {
            throw new MultiSigException(ErrorCode.NOT_PENDING, "Cannot sign " + p.getStatus().wire() + " proposal");
        }
        if (p.expiredAt(clock.instant())) {
            return new Attempt(null, proposalService.expireLocked(p));
        }
        if (p.hasSignatureFrom(validatorId)) {
            throw alreadySigned(validatorId);
        }

        Validator v = registry.get(validatorId);
        if (!v.isActive() || (cmd.signedBy() != null && !cmd.signedBy().equals(v.getUserId()))) {
            throw new MultiSigException(ErrorCode.UNAUTHORIZED, "Validator " + validatorId + " cannot sign for this caller");
        }
        if (cmd.signerType() != v.getKind()) {
            throw new MultiSigException(ErrorCode.INVALID_SIGNATURE,
                    "Signer type does not match validator kind " + v.getKind().wire());
        }
        if (cmd.signature() == null || cmd.signature().isBlank() || cmd.signedAt() == null
                || !verifier.verify(CanonicalPayload.of(p, cmd.signedAt()), cmd.signature(), v)) {
            throw new MultiSigException(ErrorCode.INVALID_SIGNATURE, "Invalid signature");
        }
        if (!freshness.isFresh(cmd.signedAt())) {
            throw new MultiSigException(ErrorCode.STALE_SIGNATURE, "Signature timestamp is outside the accepted window");
        }

        ProposalSignature sig = new ProposalSignature(validatorId, cmd.signature(), cmd.signerType(),
                cmd.signedAt(), cmd.signedBy(), cmd.metadata());
        try {
            proposalRepository.appendSignature(p.getId(), sig, p.getCollectedSignatures());
        } catch (DuplicateKeyException e) {
            throw alreadySigned(validatorId);
        }
        registry.touch(validatorId);

        Proposal signed = p.withSignature(sig);
        log.info("Proposal {} signed by {} ({}/{})", p.getId(), validatorId,
                signed.getCollectedSignatures(), signed.getRequiredSignatures());
        return new Attempt(signed, null);
    }

    private static MultiSigException alreadySigned(String validatorId) {
        return new MultiSigException(ErrorCode.ALREADY_SIGNED, "Validator " + validatorId + " already signed this proposal");
    }

    private record Attempt(Proposal signed, Proposal expired) {}
}
