package com.sommerph.zkinbox.model.encryption;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Both keys are Base64 of a P-256 JWK; the private one carries {@code d}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecipientKeyPair {

    private String publicKey;
    private String privateKey;

    @Override
    public String toString() {
        return "RecipientKeyPair(publicKey=" + publicKey + ")";
    }

}
