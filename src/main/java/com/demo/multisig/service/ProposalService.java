package com.demo.multisig.service;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.model.ProposalMetadata;
import com.demo.multisig.model.ProposalStatus;
import com.demo.multisig.model.Validator;
import com.demo.multisig.repository.ProposalQuery;
import com.demo.multisig.repository.ProposalRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Owns proposal records and their lifecycle. Every status change runs under the
 * proposal's lock and is announced once the lock is released.
 */
@Slf4j
@Service
public class ProposalService {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern HEX_DATA = Pattern.compile("^0x([0-9a-fA-F]{2})*$");
    private static final int MAX_DECIMALS = 18;
    // amount_eth is DECIMAL(38,18)
    private static final int MAX_INTEGER_DIGITS = 20;

    private final ProposalRepository proposalRepository;
    private final ValidatorRegistry registry;
    private final KeyedLocks locks;
    private final ProposalEvents events;
    private final Clock clock;
    private final Duration defaultTtl;
    private final Duration maxTtl;

    public ProposalService(ProposalRepository proposalRepository,
                           ValidatorRegistry registry,
                           KeyedLocks locks,
                           ProposalEvents events,
                           Clock clock,
                           @Value("${multisig.proposal.default-ttl-seconds:86400}") long defaultTtlSeconds,
                           @Value("${multisig.proposal.max-ttl-seconds:2592000}") long maxTtlSeconds) {
        this.proposalRepository = proposalRepository;
        this.registry = registry;
        this.locks = locks;
        this.events = events;
        this.clock = clock;
        this.defaultTtl = Duration.ofSeconds(defaultTtlSeconds);
        this.maxTtl = Duration.ofSeconds(maxTtlSeconds);
    }

    public Proposal create(String userId, ProposalDraft draft) {
        validate(draft);
        Duration ttl = draft.ttlSeconds() == null ? defaultTtl : Duration.ofSeconds(draft.ttlSeconds());
        Instant now = clock.instant();

        Proposal p = Proposal.builder()
                .id(UUID.randomUUID().toString())
                .createdBy(userId)
                .to(draft.to())
                .value(draft.value().stripTrailingZeros())
                .data(draft.data() == null || draft.data().isBlank() ? null : draft.data())
                .requiredSignatures(draft.requiredSignatures())
                .validatorIds(List.copyOf(draft.validatorIds()))
                .signatures(List.of())
                .status(ProposalStatus.PENDING)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .metadata(draft.metadata() == null ? ProposalMetadata.empty() : draft.metadata())
                .build();
        proposalRepository.insert(p);
        log.info("Proposal {} created by {}: {} of {} signature(s), expires {}",
                p.getId(), userId, p.getRequiredSignatures(), p.getValidatorIds().size(), p.getExpiresAt());

        events.created(p);
        return p;
    }

    public Proposal get(String proposalId) {
        return proposalRepository.findById(proposalId)
                .orElseThrow(() -> MultiSigException.proposalNotFound(proposalId));
    }

    /** Like {@link #get} but only for the creator or an owner of an eligible validator. */
    public Proposal getForUser(String proposalId, String userId) {
        Proposal p = get(proposalId);
        if (!userHasAccess(userId, p)) {
            throw new MultiSigException(ErrorCode.ACCESS_DENIED, "No access to proposal " + proposalId);
        }
        return p;
    }

    public List<Proposal> listForUser(String userId, ProposalQuery query) {
        return proposalRepository.findForUser(userId, registry.idsOwnedBy(userId), query);
    }

    public boolean userHasAccess(String userId, String proposalId) {
        return userHasAccess(userId, get(proposalId));
    }

    boolean userHasAccess(String userId, Proposal p) {
        if (userId == null) return false;
        return userId.equals(p.getCreatedBy()) || registry.ownersOf(p.getValidatorIds()).contains(userId);
    }

    public Proposal cancel(String proposalId, String userId) {
        Proposal cancelled = locks.withLock(lockKey(proposalId), () -> {
            Proposal p = get(proposalId);
            if (!p.getCreatedBy().equals(userId)) {
                throw new MultiSigException(ErrorCode.ACCESS_DENIED, "Only the creator can cancel proposal " + proposalId);
            }
            if (p.getStatus() != ProposalStatus.PENDING) {
                throw new MultiSigException(ErrorCode.ALREADY_RESOLVED,
                        "Proposal " + proposalId + " is already " + p.getStatus().wire());
            }
            Proposal next = p.transitionTo(ProposalStatus.CANCELLED);
            proposalRepository.updateResolution(next);
            return next;
        });
        log.info("Proposal {} cancelled by {}", proposalId, userId);
        events.cancelled(cancelled, userId);
        return cancelled;
    }

    /**
     * Moves an overdue pending proposal to {@code expired}.
     *
     * @return false when the proposal was already resolved or is not yet due
     */
    public boolean expire(String proposalId) {
        Proposal expired = locks.withLock(lockKey(proposalId), () -> {
            Proposal p = get(proposalId);
            if (p.getStatus() != ProposalStatus.PENDING || !p.expiredAt(clock.instant())) {
                return null;
            }
            return expireLocked(p);
        });
        if (expired == null) return false;
        events.expired(expired);
        return true;
    }

    /** Caller must hold the proposal's lock. */
    Proposal expireLocked(Proposal p) {
        Proposal next = p.transitionTo(ProposalStatus.EXPIRED);
        proposalRepository.updateResolution(next);
        log.info("Proposal {} expired with {}/{} signature(s)",
                p.getId(), p.getCollectedSignatures(), p.getRequiredSignatures());
        return next;
    }

    static String lockKey(String proposalId) {
        return "proposal:" + proposalId;
    }

    private void validate(ProposalDraft d) {
        if (d.to() == null || !ADDRESS.matcher(d.to()).matches()) {
            throw invalid("Destination must be a 0x-prefixed 20-byte address");
        }
        BigDecimal value = d.value();
        if (value == null || value.signum() < 0) {
            throw invalid("Value must be zero or positive");
        }
        if (value.stripTrailingZeros().scale() > MAX_DECIMALS) {
            throw invalid("Value has more than " + MAX_DECIMALS + " decimals");
        }
        if (value.precision() - value.scale() > MAX_INTEGER_DIGITS) {
            throw invalid("Value exceeds " + MAX_INTEGER_DIGITS + " integer digits");
        }
        if (d.data() != null && !d.data().isBlank() && !HEX_DATA.matcher(d.data()).matches()) {
            throw invalid("Call data must be 0x-prefixed hex");
        }
        List<String> ids = d.validatorIds();
        if (ids == null || ids.isEmpty()) {
            throw invalid("At least one validator is required");
        }
        if (new HashSet<>(ids).size() != ids.size()) {
            throw invalid("Validator ids must be distinct");
        }
        if (d.requiredSignatures() < 1 || d.requiredSignatures() > ids.size()) {
            throw invalid("Required signatures must be between 1 and " + ids.size());
        }
        if (d.ttlSeconds() != null && (d.ttlSeconds() <= 0 || d.ttlSeconds() > maxTtl.getSeconds())) {
            throw invalid("TTL must be between 1 and " + maxTtl.getSeconds() + " seconds");
        }
        Map<String, Validator> known = registry.resolve(ids);
        for (String id : ids) {
            Validator v = known.get(id);
            if (v == null || !v.isActive()) {
                throw invalid("Unknown or inactive validator: " + id);
            }
        }
    }

    private static MultiSigException invalid(String message) {
        return new MultiSigException(ErrorCode.INVALID_PROPOSAL, message);
    }
}
