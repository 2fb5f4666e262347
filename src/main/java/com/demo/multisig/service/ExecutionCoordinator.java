package com.demo.multisig.service;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.model.ProposalSignature;
import com.demo.multisig.model.ProposalStatus;
import com.demo.multisig.model.Validator;
import com.demo.multisig.model.ValidatorKind;
import com.demo.multisig.repository.ProposalRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.web3j.utils.Convert;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns a proposal that reached quorum into exactly one broadcast. The quorum
 * check, the broadcast and the terminal status write all happen under the
 * proposal's lock, so concurrent callers can never execute twice.
 */
@Slf4j
@Service
public class ExecutionCoordinator {

    private static final int WEIGHT_PER_VALIDATOR = 1;
    private static final int RECORD_ATTEMPTS = 3;

    private final ProposalRepository proposalRepository;
    private final ProposalService proposalService;
    private final ValidatorRegistry registry;
    private final SignatureVerifier verifier;
    private final ExecutionBroadcaster broadcaster;
    private final GasPriceOracle gasPriceOracle;
    private final FreshnessWindow freshness;
    private final KeyedLocks locks;
    private final ProposalEvents events;
    private final Clock clock;

    private final long callGas;
    private final long verificationGasPerSignature;
    private final long preVerificationGas;

    // proposal id -> tx hash of broadcasts whose executed state is not stored yet
    private final Map<String, String> unrecorded = new ConcurrentHashMap<>();

    public ExecutionCoordinator(ProposalRepository proposalRepository,
                                ProposalService proposalService,
                                ValidatorRegistry registry,
                                SignatureVerifier verifier,
                                ExecutionBroadcaster broadcaster,
                                GasPriceOracle gasPriceOracle,
                                FreshnessWindow freshness,
                                KeyedLocks locks,
                                ProposalEvents events,
                                Clock clock,
                                @Value("${multisig.gas.call-gas:100000}") long callGas,
                                @Value("${multisig.gas.verification-gas-per-signature:25000}") long verificationGasPerSignature,
                                @Value("${multisig.gas.pre-verification-gas:25000}") long preVerificationGas) {
        this.proposalRepository = proposalRepository;
        this.proposalService = proposalService;
        this.registry = registry;
        this.verifier = verifier;
        this.broadcaster = broadcaster;
        this.gasPriceOracle = gasPriceOracle;
        this.freshness = freshness;
        this.locks = locks;
        this.events = events;
        this.clock = clock;
        this.callGas = callGas;
        this.verificationGasPerSignature = verificationGasPerSignature;
        this.preVerificationGas = preVerificationGas;
    }

    /**
     * Executes the proposal if it is pending, unexpired and at quorum. Safe to call
     * any number of times; only the first caller past quorum broadcasts.
     */
    public ExecutionResult tryExecute(String proposalId) {
        Proposal[] transitioned = new Proposal[1];
        ExecutionResult result = locks.withLock(ProposalService.lockKey(proposalId), () -> {
            Proposal p = proposalService.get(proposalId);
            if (p.getStatus() != ProposalStatus.PENDING) {
                return ExecutionResult.skipped();
            }
            String onChain = unrecorded.get(proposalId);
            if (onChain != null) {
                // already broadcast; only the executed state is still missing
                Proposal done = p.executed(onChain, clock.instant());
                if (recordExecuted(done)) {
                    unrecorded.remove(proposalId);
                    transitioned[0] = done;
                }
                return ExecutionResult.executed(onChain);
            }
            if (p.expiredAt(clock.instant())) {
                transitioned[0] = proposalService.expireLocked(p);
                return ExecutionResult.failed(ErrorCode.EXPIRED, "Proposal expired");
            }
            if (!p.quorumReached()) {
                return ExecutionResult.skipped();
            }

            AggregatedSignature aggregate = aggregate(p);
            if (aggregate.totalWeight() < p.getRequiredSignatures()) {
                throw new MultiSigException(ErrorCode.INSUFFICIENT_WEIGHT,
                        "Aggregate weight " + aggregate.totalWeight() + " below required " + p.getRequiredSignatures());
            }

            GasEstimate gas = estimateGas(p, p.getSignatures());
            ExecutionBroadcaster.ExecutionRequest request = new ExecutionBroadcaster.ExecutionRequest(
                    p.getTo(),
                    Convert.toWei(p.getValue(), Convert.Unit.ETHER).toBigIntegerExact(),
                    p.getData() == null ? "0x" : p.getData(),
                    aggregate,
                    gas.gasLimit(),
                    gas.gasPrice());

            String txHash;
            try {
                txHash = broadcaster.execute(request);
            } catch (BroadcastException | RuntimeException e) {
                String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                proposalRepository.updateResolution(p.failed(reason, clock.instant()));
                log.error("Execution of proposal {} failed: {}", proposalId, reason, e);
                return ExecutionResult.failed(ErrorCode.EXECUTION_FAILED, reason);
            }

            Proposal done = p.executed(txHash, clock.instant());
            if (recordExecuted(done)) {
                transitioned[0] = done;
            } else {
                unrecorded.put(proposalId, txHash);
            }
            log.info("Proposal {} executed, tx {}", proposalId, txHash);
            return ExecutionResult.executed(txHash);
        });

        Proposal after = transitioned[0];
        if (after != null && after.getStatus() == ProposalStatus.EXECUTED) {
            events.executed(after);
        } else if (after != null && after.getStatus() == ProposalStatus.EXPIRED) {
            events.expired(after);
        }
        return result;
    }

    private boolean recordExecuted(Proposal done) {
        for (int attempt = 1; ; attempt++) {
            try {
                proposalRepository.updateResolution(done);
                return true;
            } catch (DataAccessException e) {
                if (attempt >= RECORD_ATTEMPTS) {
                    log.error("Proposal {} is on chain as {} but its executed state could not be stored",
                            done.getId(), done.getTransactionHash(), e);
                    return false;
                }
                log.warn("Storing executed state of proposal {} failed (attempt {}): {}",
                        done.getId(), attempt, e.toString());
            }
        }
    }

    public GasEstimate estimateGas(String proposalId) {
        Proposal p = proposalService.get(proposalId);
        int signers = Math.max(p.getRequiredSignatures(), p.getCollectedSignatures());
        return estimate(p.getData(), signers);
    }

    public GasEstimate estimateGas(Proposal proposal, List<ProposalSignature> signatures) {
        return estimate(proposal.getData(), signatures.size());
    }

    /**
     * Read-only pre-flight: would the proposal execute if {@code candidates} were
     * added to the signatures it already holds? Stored signatures were verified on
     * acceptance, so only their signer's eligibility and activity are rechecked.
     */
    public Preflight canExecute(String proposalId, List<ProposalSignature> candidates) {
        Proposal p = proposalService.get(proposalId);
        int required = p.getRequiredSignatures();
        if (p.getStatus() != ProposalStatus.PENDING) {
            return Preflight.blocked(0, required, "Proposal is " + p.getStatus().wire());
        }
        if (p.expiredAt(clock.instant())) {
            return Preflight.blocked(0, required, "Proposal expired");
        }

        List<ProposalSignature> all = new ArrayList<>(p.getSignatures());
        all.addAll(candidates == null ? List.of() : candidates);
        Set<String> stored = new HashSet<>();
        p.getSignatures().forEach(s -> stored.add(s.validatorId()));
        Map<String, Validator> validators = registry.resolve(all.stream().map(ProposalSignature::validatorId).toList());

        Set<String> seen = new HashSet<>();
        String reason = null;
        int index = 0;
        for (ProposalSignature s : all) {
            boolean candidate = index++ >= p.getSignatures().size();
            String problem = problemWith(p, s, validators.get(s.validatorId()), seen, candidate && stored.contains(s.validatorId()), candidate);
            if (problem != null) {
                if (reason == null) reason = problem;
                continue;
            }
            seen.add(s.validatorId());
        }

        int valid = seen.size();
        if (valid >= required) {
            return Preflight.ok(valid, required);
        }
        return Preflight.blocked(valid, required,
                reason != null ? reason : "Need " + (required - valid) + " more signature(s)");
    }

    private String problemWith(Proposal p, ProposalSignature s, Validator v, Set<String> seen,
                               boolean alreadyStored, boolean fullCheck) {
        String id = s.validatorId();
        if (!p.isEligible(id)) return "Validator " + id + " is not eligible";
        if (v == null || !v.isActive()) return "Validator " + id + " is not active";
        if (seen.contains(id) || alreadyStored) return "Validator " + id + " already signed";
        if (!fullCheck) return null;
        if (s.signerType() != v.getKind()) return "Signer type does not match validator " + id;
        if (!verifier.verify(CanonicalPayload.of(p, s.signedAt()), s.signature(), v)) {
            return "Invalid signature from " + id;
        }
        if (!freshness.isFresh(s.signedAt())) return "Stale signature from " + id;
        return null;
    }

    AggregatedSignature aggregate(Proposal p) {
        Map<String, Validator> validators = registry.resolve(p.getSignatures().stream()
                .map(ProposalSignature::validatorId).toList());
        List<AggregatedSignature.Entry> entries = new ArrayList<>();
        for (ProposalSignature s : p.getSignatures()) {
            Validator v = validators.get(s.validatorId());
            if (v == null) {
                log.warn("Signer {} of proposal {} no longer resolves; left out of the aggregate", s.validatorId(), p.getId());
                continue;
            }
            entries.add(new AggregatedSignature.Entry(s.validatorId(), v.signerAddress(), WEIGHT_PER_VALIDATOR,
                    s.signerType(), signatureBytes(s.signerType(), s.signature())));
        }
        return new AggregatedSignature(entries);
    }

    private GasEstimate estimate(String data, int signers) {
        BigInteger gasLimit = BigInteger.valueOf(callGas
                + verificationGasPerSignature * signers
                + preVerificationGas
                + calldataGas(data));
        BigInteger gasPrice = gasPriceOracle.currentGasPrice();
        return new GasEstimate(gasLimit, gasPrice, gasLimit.multiply(gasPrice));
    }

    // 16 gas per non-zero byte, 4 per zero byte
    static long calldataGas(String data) {
        if (data == null || data.isBlank() || "0x".equalsIgnoreCase(data)) return 0;
        long gas = 0;
        for (byte b : Numeric.hexStringToByteArray(data)) {
            gas += b == 0 ? 4 : 16;
        }
        return gas;
    }

    static byte[] signatureBytes(ValidatorKind kind, String blob) {
        if (kind == ValidatorKind.SOCIAL) {
            return Numeric.hexStringToByteArray(blob);
        }
        return Base64.getDecoder().decode(blob);
    }
}
