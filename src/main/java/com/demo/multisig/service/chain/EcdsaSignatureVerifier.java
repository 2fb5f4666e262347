package com.demo.multisig.service.chain;

import com.demo.multisig.model.Validator;
import com.demo.multisig.model.ValidatorKind;
import com.demo.multisig.service.CanonicalPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Set;

/**
 * Passkeys and hardware keys: P-256 ECDSA (SHA-256) over the payload bytes.
 * Public key is base64 X.509, signature base64 DER.
 */
@Slf4j
@Component
class EcdsaSignatureVerifier implements KindVerifier {

    @Override
    public Set<ValidatorKind> kinds() {
        return Set.of(ValidatorKind.PASSKEY, ValidatorKind.HARDWARE);
    }

    @Override
    public boolean verify(CanonicalPayload payload, String signature, Validator validator) {
        if (validator.getPublicKey() == null || signature == null) {
            return false;
        }
        try {
            PublicKey key = KeyFactory.getInstance("EC")
                    .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(validator.getPublicKey())));
            Signature ecdsa = Signature.getInstance("SHA256withECDSA");
            ecdsa.initVerify(key);
            ecdsa.update(payload.bytes());
            return ecdsa.verify(Base64.getDecoder().decode(signature));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("ECDSA signature rejected for validator {}: {}", validator.getId(), e.toString());
            return false;
        }
    }
}
