package com.demo.multisig.service;

public record Preflight(boolean canExecute, int validSignatures, int requiredSignatures, String reason) {

    static Preflight ok(int valid, int required) {
        return new Preflight(true, valid, required, null);
    }

    static Preflight blocked(int valid, int required, String reason) {
        return new Preflight(false, valid, required, reason);
    }
}
