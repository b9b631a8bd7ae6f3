package com.sommerph.zkinbox.service.encryption;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.zkinbox.config.InboxProperties;
import com.sommerph.zkinbox.exception.DecryptionFailureException;
import com.sommerph.zkinbox.exception.EncryptionFailureException;
import com.sommerph.zkinbox.exception.InvalidRecipientKeyException;
import com.sommerph.zkinbox.model.encryption.EncryptedEnvelope;
import com.sommerph.zkinbox.model.encryption.KeyValidation;
import com.sommerph.zkinbox.model.encryption.RecipientKeyPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.*;
import java.util.Arrays;
import java.util.Base64;

/**
 * ECDH (P-256) with a fresh ephemeral key per message, HKDF-SHA256 key derivation
 * and AES-256-GCM. Payloads are opaque bytes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridEncryptionService {

    public static final int IV_SIZE = 12;       // 96-bit nonce
    private static final int TAG_SIZE = 128;    // bits
    private static final int KEY_SIZE = 32;     // AES-256
    private static final String AES_ALGO = "AES/GCM/NoPadding";

    private static final String DECRYPTION_FAILED = "Failed to decrypt payload";

    private final JwkKeyCodec keyCodec;
    private final SecureRandom secureRandom;
    private final InboxProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    public RecipientKeyPair generateKeyPair() {
        log.info("Generate recipient key pair on {}", JwkKeyCodec.CURVE);
        try {
            KeyPair keyPair = newEphemeralKeyPair();
            return new RecipientKeyPair(
                    keyCodec.encodePublicKey(keyPair.getPublic()),
                    keyCodec.encodePrivateKey(keyPair.getPrivate(), keyPair.getPublic()));
        } catch (GeneralSecurityException e) {
            log.error("Recipient key generation failed", e);
            throw new EncryptionFailureException("Failed to generate recipient key pair", e);
        }
    }

    public KeyValidation validatePublicKey(String recipientPublicKey) {
        return keyCodec.validatePublicKey(recipientPublicKey);
    }

    /**
     * @throws InvalidRecipientKeyException if the key is not an importable P-256 JWK
     * @throws EncryptionFailureException   on any primitive failure
     */
    public EncryptedEnvelope encrypt(byte[] message, String recipientPublicKey) {
        KeyValidation validation = keyCodec.validatePublicKey(recipientPublicKey);
        if (!validation.isValid()) {
            log.info("Reject recipient key: {}", validation.getError());
            throw new InvalidRecipientKeyException(validation.getError());
        }
        try {
            PublicKey recipientKey = keyCodec.decodePublicKey(recipientPublicKey);
            KeyPair ephemeral = newEphemeralKeyPair();
            byte[] aesKey = deriveKey(agree(ephemeral.getPrivate(), recipientKey));

            byte[] iv = new byte[IV_SIZE];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(AES_ALGO, "BC");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(aesKey, "AES"), new GCMParameterSpec(TAG_SIZE, iv));
            byte[] ciphertext = cipher.doFinal(message);
            Arrays.fill(aesKey, (byte) 0);

            return new EncryptedEnvelope(
                    Base64.getEncoder().encodeToString(ciphertext),
                    keyCodec.encodePublicKey(ephemeral.getPublic()),
                    Base64.getEncoder().encodeToString(iv));
        } catch (GeneralSecurityException | RuntimeException e) {
            log.error("Payload encryption failed", e);
            throw new EncryptionFailureException("Failed to encrypt payload", e);
        }
    }

    public EncryptedEnvelope encrypt(String message, String recipientPublicKey) {
        return encrypt(message.getBytes(StandardCharsets.UTF_8), recipientPublicKey);
    }

    /**
     * @throws DecryptionFailureException for a wrong key, tampered data or a malformed envelope alike
     */
    public byte[] decrypt(EncryptedEnvelope envelope, String recipientPrivateKey) {
        try {
            if (!isWellFormed(envelope)) {
                throw new GeneralSecurityException("Malformed envelope");
            }
            PrivateKey privateKey = keyCodec.decodePrivateKey(recipientPrivateKey);
            PublicKey ephemeralKey = keyCodec.decodePublicKey(envelope.getEphemeralPublicKey());
            byte[] aesKey = deriveKey(agree(privateKey, ephemeralKey));

            Cipher cipher = Cipher.getInstance(AES_ALGO, "BC");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(aesKey, "AES"),
                    new GCMParameterSpec(TAG_SIZE, Base64.getDecoder().decode(envelope.getIv())));
            Arrays.fill(aesKey, (byte) 0);
            return cipher.doFinal(Base64.getDecoder().decode(envelope.getCiphertext()));
        } catch (GeneralSecurityException | RuntimeException e) {
            log.debug("Decryption rejected", e);
            throw new DecryptionFailureException(DECRYPTION_FAILED);
        }
    }

    public String decryptToString(EncryptedEnvelope envelope, String recipientPrivateKey) {
        return new String(decrypt(envelope, recipientPrivateKey), StandardCharsets.UTF_8);
    }

    /**
     * All fields present and Base64, a 12-byte IV, a ciphertext at least one GCM tag long
     * and an ephemeral key that imports.
     */
    public boolean isWellFormed(EncryptedEnvelope envelope) {
        if (envelope == null || isBlank(envelope.getCiphertext())
                || isBlank(envelope.getEphemeralPublicKey()) || isBlank(envelope.getIv())) {
            return false;
        }
        try {
            byte[] iv = Base64.getDecoder().decode(envelope.getIv());
            byte[] ciphertext = Base64.getDecoder().decode(envelope.getCiphertext());
            return iv.length == IV_SIZE
                    && ciphertext.length >= TAG_SIZE / 8
                    && keyCodec.validatePublicKey(envelope.getEphemeralPublicKey()).isValid();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public String stringify(EncryptedEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new EncryptionFailureException("Failed to serialize envelope", e);
        }
    }

    public EncryptedEnvelope parseEnvelope(String json) {
        try {
            return mapper.readValue(json, EncryptedEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new DecryptionFailureException(DECRYPTION_FAILED);
        }
    }

    private KeyPair newEphemeralKeyPair() throws GeneralSecurityException {
        KeyPairGenerator keyGen = KeyPairGenerator.getInstance("EC", "BC");
        keyGen.initialize(keyCodec.generationSpec(), secureRandom);
        return keyGen.generateKeyPair();
    }

    private byte[] agree(PrivateKey privateKey, PublicKey publicKey) throws GeneralSecurityException {
        KeyAgreement agreement = KeyAgreement.getInstance("ECDH", "BC");
        agreement.init(privateKey);
        agreement.doPhase(publicKey, true);
        return agreement.generateSecret();
    }

    private byte[] deriveKey(byte[] sharedSecret) {
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        byte[] info = properties.getEncryption().getHkdfInfo().getBytes(StandardCharsets.UTF_8);
        hkdf.init(new HKDFParameters(sharedSecret, null, info));
        byte[] key = new byte[KEY_SIZE];
        hkdf.generateBytes(key, 0, KEY_SIZE);
        Arrays.fill(sharedSecret, (byte) 0);
        return key;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

}
