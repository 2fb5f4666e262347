package com.demo.multisig.service;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    ACCESS_DENIED(HttpStatus.FORBIDDEN),
    ALREADY_SIGNED(HttpStatus.CONFLICT),
    INVALID_SIGNATURE(HttpStatus.BAD_REQUEST),
    STALE_SIGNATURE(HttpStatus.BAD_REQUEST),
    NOT_PENDING(HttpStatus.CONFLICT),
    EXPIRED(HttpStatus.GONE),
    ALREADY_RESOLVED(HttpStatus.CONFLICT),
    INSUFFICIENT_WEIGHT(HttpStatus.INTERNAL_SERVER_ERROR),
    EXECUTION_FAILED(HttpStatus.BAD_GATEWAY),
    INVALID_THRESHOLD(HttpStatus.BAD_REQUEST),
    LAST_VALIDATOR_REMOVAL(HttpStatus.CONFLICT),
    DUPLICATE_VALIDATOR(HttpStatus.CONFLICT),
    INVALID_VALIDATOR(HttpStatus.BAD_REQUEST),
    INVALID_PROPOSAL(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
