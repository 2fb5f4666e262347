package com.demo.multisig.service;

import com.demo.multisig.model.Proposal;
import org.web3j.crypto.Hash;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;

/**
 * The exact message every validator signs for a proposal. Field order and
 * formatting are fixed so that client and server derive identical bytes.
 */
public record CanonicalPayload(String proposalId, String to, String value, String data, long signedAt) {

    public static CanonicalPayload of(Proposal proposal, Instant signedAt) {
        return new CanonicalPayload(
                proposal.getId(),
                proposal.getTo().toLowerCase(Locale.ROOT),
                plain(proposal.getValue()),
                proposal.getData() == null || proposal.getData().isBlank() ? "0x" : proposal.getData().toLowerCase(Locale.ROOT),
                signedAt.toEpochMilli());
    }

    public static String plain(BigDecimal value) {
        return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
    }

    public String message() {
        return "{\"proposalId\":\"" + proposalId + "\""
                + ",\"to\":\"" + to + "\""
                + ",\"value\":\"" + value + "\""
                + ",\"data\":\"" + data + "\""
                + ",\"signedAt\":" + signedAt + "}";
    }

    public byte[] bytes() {
        return message().getBytes(StandardCharsets.UTF_8);
    }

    /** Keccak-256 of {@link #bytes()}. */
    public byte[] digest() {
        return Hash.sha3(bytes());
    }
}
