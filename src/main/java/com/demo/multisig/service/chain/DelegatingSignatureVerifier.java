package com.demo.multisig.service.chain;

import com.demo.multisig.model.Validator;
import com.demo.multisig.model.ValidatorKind;
import com.demo.multisig.service.CanonicalPayload;
import com.demo.multisig.service.SignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class DelegatingSignatureVerifier implements SignatureVerifier {

    private final Map<ValidatorKind, KindVerifier> byKind = new EnumMap<>(ValidatorKind.class);

    DelegatingSignatureVerifier(List<KindVerifier> verifiers) {
        for (KindVerifier v : verifiers) {
            v.kinds().forEach(k -> byKind.put(k, v));
        }
    }

    @Override
    public boolean verify(CanonicalPayload payload, String signature, Validator validator) {
        KindVerifier v = byKind.get(validator.getKind());
        if (v == null) {
            log.warn("No verifier for validator kind {}", validator.getKind());
            return false;
        }
        return v.verify(payload, signature, validator);
    }
}
