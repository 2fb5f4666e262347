package com.demo.multisig.service;

import com.demo.multisig.model.Validator;

/** Cryptographic check of one validator's signature over a proposal payload. */
public interface SignatureVerifier {

    boolean verify(CanonicalPayload payload, String signature, Validator validator);
}
