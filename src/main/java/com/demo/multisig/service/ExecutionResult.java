package com.demo.multisig.service;

/** Outcome of one {@link ExecutionCoordinator#tryExecute} call. */
public record ExecutionResult(boolean executed, String transactionHash, ErrorCode errorCode, String error) {

    public static ExecutionResult executed(String transactionHash) {
        return new ExecutionResult(true, transactionHash, null, null);
    }

    public static ExecutionResult skipped() {
        return new ExecutionResult(false, null, null, null);
    }

    public static ExecutionResult failed(ErrorCode code, String error) {
        return new ExecutionResult(false, null, code, error);
    }
}
