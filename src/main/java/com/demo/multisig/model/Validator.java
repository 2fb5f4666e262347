package com.demo.multisig.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Locale;

/** One authentication factor owned by a user account. */
@Value
@Builder(toBuilder = true)
public class Validator {
    String id;
    String userId;
    ValidatorKind kind;
    String name;
    /** Base64 X.509 SubjectPublicKeyInfo for passkey/hardware keys; null for social keys. */
    String publicKey;
    ValidatorMetadata metadata;
    Instant createdAt;
    Instant lastUsed;
    boolean active;

    /**
     * Address this validator signs as inside an aggregated signature. Social and
     * hardware keys carry an EOA address; passkeys derive one from their public key.
     */
    @JsonIgnore
    public String signerAddress() {
        if (metadata instanceof ValidatorMetadata.Social s && s.publicAddress() != null) {
            return s.publicAddress().toLowerCase(Locale.ROOT);
        }
        if (metadata instanceof ValidatorMetadata.Hardware h && h.publicAddress() != null) {
            return h.publicAddress().toLowerCase(Locale.ROOT);
        }
        byte[] source = publicKey != null
                ? Base64.getDecoder().decode(publicKey)
                : id.getBytes(java.nio.charset.StandardCharsets.UTF_8);
        byte[] hash = Hash.sha3(source);
        return Numeric.toHexString(Arrays.copyOfRange(hash, 12, 32));
    }
}
