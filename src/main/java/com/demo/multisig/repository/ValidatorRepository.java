package com.demo.multisig.repository;

import com.demo.multisig.model.SigningPolicy;
import com.demo.multisig.model.Validator;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ValidatorRepository {

    Optional<Validator> findById(String validatorId);

    /** Every validator of the account, active or not, oldest first. */
    List<Validator> findByUser(String userId);

    List<Validator> findByIds(Collection<String> validatorIds);

    void insert(Validator validator);

    void updateActive(String validatorId, boolean active);

    void touch(String validatorId, Instant lastUsed);

    Optional<SigningPolicy> findPolicy(String userId);

    void savePolicy(String userId, SigningPolicy policy);
}
