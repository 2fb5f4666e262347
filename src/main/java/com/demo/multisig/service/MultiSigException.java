package com.demo.multisig.service;

import lombok.Getter;

/**
 * Typed failure of a coordination operation. The {@link ErrorCode} tells a client
 * precisely which rule rejected the request.
 */
@Getter
public class MultiSigException extends RuntimeException {

    private final ErrorCode code;

    public MultiSigException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public MultiSigException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static MultiSigException proposalNotFound(String proposalId) {
        return new MultiSigException(ErrorCode.NOT_FOUND, "Proposal not found: " + proposalId);
    }

    public static MultiSigException validatorNotFound(String validatorId) {
        return new MultiSigException(ErrorCode.NOT_FOUND, "Validator not found: " + validatorId);
    }
}
