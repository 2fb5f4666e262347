package com.demo.multisig.service.chain;

import com.demo.multisig.model.Validator;
import com.demo.multisig.model.ValidatorKind;
import com.demo.multisig.service.CanonicalPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Social-login keys sign with {@code personal_sign}: secp256k1 over the
 * Ethereum-prefixed payload, encoded as 0x-hex {@code r || s || v}. The recovered
 * address must equal the validator's address.
 */
@Slf4j
@Component
class SocialSignatureVerifier implements KindVerifier {

    private static final int SIGNATURE_LENGTH = 65;

    @Override
    public Set<ValidatorKind> kinds() {
        return Set.of(ValidatorKind.SOCIAL);
    }

    @Override
    public boolean verify(CanonicalPayload payload, String signature, Validator validator) {
        if (signature == null || !signature.startsWith("0x") || signature.length() != 2 + SIGNATURE_LENGTH * 2) {
            return false;
        }
        try {
            byte[] raw = Numeric.hexStringToByteArray(signature);
            byte v = raw[64];
            if (v < 27) v += 27;
            Sign.SignatureData data = new Sign.SignatureData(v,
                    Arrays.copyOfRange(raw, 0, 32),
                    Arrays.copyOfRange(raw, 32, 64));
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(payload.bytes(), data);
            String recovered = "0x" + Keys.getAddress(publicKey);
            return recovered.equals(validator.signerAddress().toLowerCase(Locale.ROOT));
        } catch (SignatureException | RuntimeException e) {
            log.debug("Social signature rejected for validator {}: {}", validator.getId(), e.toString());
            return false;
        }
    }
}
