package com.demo.multisig.service.chain;

import com.demo.multisig.model.Validator;
import com.demo.multisig.model.ValidatorKind;
import com.demo.multisig.service.CanonicalPayload;

import java.util.Set;

/** Signature scheme for one or more validator kinds. */
interface KindVerifier {

    Set<ValidatorKind> kinds();

    boolean verify(CanonicalPayload payload, String signature, Validator validator);
}
