package com.sommerph.zkinbox.model.encryption;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedEnvelope {

    private String ciphertext;          // Base64, AES-GCM output including the 16-byte tag
    private String ephemeralPublicKey;  // Base64 of the serialized P-256 JWK
    private String iv;                  // Base64, 12 bytes

}
