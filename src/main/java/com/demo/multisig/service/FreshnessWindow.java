package com.demo.multisig.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** Replay window for {@code signedAt}: not older than max-age, not ahead by more than the skew. */
@Component
public class FreshnessWindow {

    private final Clock clock;
    private final Duration maxAge;
    private final Duration clockSkew;

    public FreshnessWindow(Clock clock,
                           @Value("${multisig.signature.max-age-seconds:86400}") long maxAgeSeconds,
                           @Value("${multisig.signature.clock-skew-seconds:300}") long clockSkewSeconds) {
        this.clock = clock;
        this.maxAge = Duration.ofSeconds(maxAgeSeconds);
        this.clockSkew = Duration.ofSeconds(clockSkewSeconds);
    }

    public boolean isFresh(Instant signedAt) {
        if (signedAt == null) return false;
        Instant now = clock.instant();
        return !signedAt.isBefore(now.minus(maxAge)) && !signedAt.isAfter(now.plus(clockSkew));
    }
}
