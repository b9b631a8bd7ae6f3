package com.sommerph.zkinbox.service.identity;

import com.sommerph.zkinbox.exception.EntropySourceUnavailableException;
import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.identity.Identity;
import com.sommerph.zkinbox.service.hash.FieldHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.security.SecureRandom;

@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityService {

    private final FieldHasher hasher;
    private final SecureRandom secureRandom;

    public Identity generateIdentity() {
        log.info("Generate new submitter identity");
        FieldElement secret = FieldElement.of(randomScalar());
        return fromSecret(secret);
    }

    public Identity fromSecret(FieldElement secret) {
        return new Identity(secret, commitment(secret));
    }

    public FieldElement commitment(FieldElement secret) {
        return hasher.hash(secret);
    }

    // Rejection sampling keeps the secret uniform in [1, MODULUS).
    private BigInteger randomScalar() {
        int bits = FieldElement.MODULUS.bitLength();
        try {
            BigInteger candidate;
            do {
                candidate = new BigInteger(bits, secureRandom);
            } while (candidate.signum() == 0 || candidate.compareTo(FieldElement.MODULUS) >= 0);
            return candidate;
        } catch (RuntimeException e) {
            log.error("Entropy source failed while generating identity secret", e);
            throw new EntropySourceUnavailableException("Failed to draw identity secret", e);
        }
    }

}
