package com.demo.multisig.model;

import java.math.BigDecimal;

/**
 * Per-account signing policy. {@code highValueThreshold} is denominated in ETH and
 * forces multi-sig at or above that value even when {@code requireMultiSig} is off.
 */
public record SigningPolicy(boolean requireMultiSig, int threshold, BigDecimal highValueThreshold) {

    public static SigningPolicy singleSigner() {
        return new SigningPolicy(false, 1, null);
    }

    public SigningPolicy withThreshold(int newThreshold) {
        return new SigningPolicy(requireMultiSig, newThreshold, highValueThreshold);
    }

    public boolean requiresMultiSig(BigDecimal value) {
        if (requireMultiSig) return true;
        return highValueThreshold != null && value != null && value.compareTo(highValueThreshold) >= 0;
    }
}
