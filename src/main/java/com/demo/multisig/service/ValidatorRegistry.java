package com.demo.multisig.service;

import com.demo.multisig.model.SigningPolicy;
import com.demo.multisig.model.Validator;
import com.demo.multisig.model.ValidatorKind;
import com.demo.multisig.model.ValidatorMetadata;
import com.demo.multisig.repository.ValidatorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Authentication factors and signing policy of each account. Invariant per
 * account: {@code 1 <= policy.threshold <= |active validators|}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidatorRegistry {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private final ValidatorRepository validatorRepository;
    private final KeyedLocks locks;
    private final Clock clock;

    public List<Validator> listActive(String userId) {
        return validatorRepository.findByUser(userId).stream()
                .filter(Validator::isActive)
                .toList();
    }

    public Validator get(String validatorId) {
        return validatorRepository.findById(validatorId)
                .orElseThrow(() -> MultiSigException.validatorNotFound(validatorId));
    }

    public Validator add(String userId, Validator candidate) {
        checkShape(candidate);
        return locks.withLock(accountKey(userId), () -> {
            String id = candidate.getId() == null || candidate.getId().isBlank()
                    ? candidate.getKind().wire() + "_" + UUID.randomUUID()
                    : candidate.getId();
            if (validatorRepository.findById(id).isPresent()) {
                throw new MultiSigException(ErrorCode.DUPLICATE_VALIDATOR, "Validator already registered: " + id);
            }
            Validator v = candidate.toBuilder()
                    .id(id)
                    .userId(userId)
                    .createdAt(clock.instant())
                    .lastUsed(null)
                    .active(true)
                    .build();
            validatorRepository.insert(v);

            int active = listActive(userId).size();
            SigningPolicy policy = policy(userId);
            if (active > 1 && !policy.requireMultiSig()) {
                validatorRepository.savePolicy(userId,
                        new SigningPolicy(true, Math.min(2, active), policy.highValueThreshold()));
            }
            log.info("Validator {} ({}) added for user {}", id, v.getKind().wire(), userId);
            return v;
        });
    }

    /** Deactivates a validator; the last active one can never be removed. */
    public void remove(String userId, String validatorId) {
        locks.run(accountKey(userId), () -> {
            Validator v = get(validatorId);
            if (!userId.equals(v.getUserId()) || !v.isActive()) {
                throw MultiSigException.validatorNotFound(validatorId);
            }
            int active = listActive(userId).size();
            if (active <= 1) {
                throw new MultiSigException(ErrorCode.LAST_VALIDATOR_REMOVAL, "Cannot remove the last signer");
            }
            validatorRepository.updateActive(validatorId, false);

            int remaining = active - 1;
            SigningPolicy policy = policy(userId);
            SigningPolicy next = remaining == 1
                    ? new SigningPolicy(false, 1, policy.highValueThreshold())
                    : policy.withThreshold(Math.min(policy.threshold(), remaining));
            if (!next.equals(policy)) {
                validatorRepository.savePolicy(userId, next);
            }
            log.info("Validator {} removed for user {}", validatorId, userId);
        });
    }

    public SigningPolicy policy(String userId) {
        return validatorRepository.findPolicy(userId).orElseGet(SigningPolicy::singleSigner);
    }

    public SigningPolicy setPolicy(String userId, SigningPolicy policy) {
        return locks.withLock(accountKey(userId), () -> {
            int active = listActive(userId).size();
            if (policy.threshold() < 1) {
                throw new MultiSigException(ErrorCode.INVALID_THRESHOLD, "Threshold must be at least 1");
            }
            if (policy.threshold() > active) {
                throw new MultiSigException(ErrorCode.INVALID_THRESHOLD,
                        "Threshold " + policy.threshold() + " exceeds the " + active + " active validator(s)");
            }
            if (policy.highValueThreshold() != null && policy.highValueThreshold().signum() < 0) {
                throw new MultiSigException(ErrorCode.INVALID_THRESHOLD, "High value threshold must not be negative");
            }
            validatorRepository.savePolicy(userId, policy);
            return policy;
        });
    }

    public boolean requiresMultiSig(String userId, BigDecimal value) {
        return policy(userId).requiresMultiSig(value);
    }

    public void touch(String validatorId) {
        validatorRepository.touch(validatorId, clock.instant());
    }

    /** Ids of every validator the user owns, including deactivated ones. */
    public Set<String> idsOwnedBy(String userId) {
        return validatorRepository.findByUser(userId).stream()
                .map(Validator::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Users owning the given validators, in validator order. */
    public Set<String> ownersOf(Collection<String> validatorIds) {
        Map<String, Validator> byId = resolve(validatorIds);
        Set<String> owners = new LinkedHashSet<>();
        for (String id : validatorIds) {
            Validator v = byId.get(id);
            if (v != null) owners.add(v.getUserId());
        }
        return owners;
    }

    public Map<String, Validator> resolve(Collection<String> validatorIds) {
        Map<String, Validator> out = new LinkedHashMap<>();
        for (Validator v : validatorRepository.findByIds(validatorIds)) {
            out.put(v.getId(), v);
        }
        return out;
    }

    private static void checkShape(Validator v) {
        if (v.getKind() == null) {
            throw new MultiSigException(ErrorCode.INVALID_VALIDATOR, "Validator kind is required");
        }
        if (v.getMetadata() != null && v.getMetadata().kind() != v.getKind()) {
            throw new MultiSigException(ErrorCode.INVALID_VALIDATOR,
                    "Metadata of kind " + v.getMetadata().kind().wire() + " on a " + v.getKind().wire() + " validator");
        }
        if (v.getKind() == ValidatorKind.SOCIAL) {
            if (!(v.getMetadata() instanceof ValidatorMetadata.Social s)
                    || s.publicAddress() == null || !ADDRESS.matcher(s.publicAddress()).matches()) {
                throw new MultiSigException(ErrorCode.INVALID_VALIDATOR, "Social validator needs a public address");
            }
        } else if (v.getPublicKey() == null || v.getPublicKey().isBlank()) {
            throw new MultiSigException(ErrorCode.INVALID_VALIDATOR,
                    v.getKind().wire() + " validator needs a public key");
        }
    }

    private static String accountKey(String userId) {
        return "account:" + userId;
    }
}
