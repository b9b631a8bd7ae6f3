package com.sommerph.zkinbox.service.encryption;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.zkinbox.exception.EncryptionFailureException;
import com.sommerph.zkinbox.exception.KeyFileException;
import com.sommerph.zkinbox.model.encryption.KeyFile;
import com.sommerph.zkinbox.model.encryption.KeyValidation;
import com.sommerph.zkinbox.model.encryption.RecipientKeyPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Moves a recipient key pair in and out of a JSON key file, optionally sealed with
 * PBKDF2-SHA256 (100 000 iterations) and AES-256-GCM.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeyExportService {

    public static final int PBKDF2_ITERATIONS = 100_000;
    private static final int SALT_SIZE = 16;
    private static final int KEY_BITS = 256;
    private static final int TAG_SIZE = 128;
    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final String SPECIAL_CHARS = "!@#$%^&*(),.?\":{}|<>";

    private static final String IMPORT_FAILED = "Invalid key file or incorrect password";
    private static final String PASSWORD_REQUIRED = "This key file is password-protected. Please provide the password.";

    private final SecureRandom secureRandom;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * At least 8 characters and at least three of: uppercase, lowercase, digits, special characters.
     */
    public KeyValidation validatePasswordStrength(char[] password) {
        if (password == null || password.length < 8) {
            return KeyValidation.invalid("Password must be at least 8 characters long");
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean special = false;
        for (char c : password) {
            upper |= c >= 'A' && c <= 'Z';
            lower |= c >= 'a' && c <= 'z';
            digit |= c >= '0' && c <= '9';
            special |= SPECIAL_CHARS.indexOf(c) >= 0;
        }
        int classes = (upper ? 1 : 0) + (lower ? 1 : 0) + (digit ? 1 : 0) + (special ? 1 : 0);
        if (classes < 3) {
            return KeyValidation.invalid(
                    "Password must contain at least 3 of: uppercase, lowercase, numbers, special characters");
        }
        return KeyValidation.ok();
    }

    /**
     * @param password null for an unprotected file
     * @throws IllegalArgumentException if the password is too weak
     */
    public String exportKeyPair(RecipientKeyPair keyPair, char[] password) {
        if (password == null) {
            log.info("Export recipient key pair without password");
            return write(KeyFile.builder()
                    .publicKey(keyPair.getPublicKey())
                    .privateKey(keyPair.getPrivateKey())
                    .version(KeyFile.CURRENT_VERSION)
                    .passwordProtected(false)
                    .build());
        }
        KeyValidation strength = validatePasswordStrength(password);
        if (!strength.isValid()) {
            throw new IllegalArgumentException(strength.getError());
        }

        log.info("Export password-protected recipient key pair");
        byte[] salt = new byte[SALT_SIZE];
        byte[] iv = new byte[HybridEncryptionService.IV_SIZE];
        secureRandom.nextBytes(salt);
        secureRandom.nextBytes(iv);
        byte[] key = deriveKey(password, salt);
        try {
            byte[] plain = mapper.writeValueAsBytes(keyPair);
            Cipher cipher = Cipher.getInstance(AES_ALGO, "BC");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE, iv));
            byte[] encrypted = cipher.doFinal(plain);
            Arrays.fill(plain, (byte) 0);
            return write(KeyFile.builder()
                    .encrypted(Base64.getEncoder().encodeToString(encrypted))
                    .salt(Base64.getEncoder().encodeToString(salt))
                    .iv(Base64.getEncoder().encodeToString(iv))
                    .version(KeyFile.CURRENT_VERSION)
                    .passwordProtected(true)
                    .build());
        } catch (GeneralSecurityException | JsonProcessingException e) {
            log.error("Key pair export failed", e);
            throw new EncryptionFailureException("Failed to export key pair", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    /**
     * @param password null when the file is expected to be unprotected
     * @throws KeyFileException if the file is unreadable, the password is wrong or missing
     */
    public RecipientKeyPair importKeyPair(String keyFileJson, char[] password) {
        KeyFile keyFile;
        try {
            keyFile = mapper.readValue(keyFileJson, KeyFile.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new KeyFileException(IMPORT_FAILED);
        }
        if (keyFile == null) {
            throw new KeyFileException(IMPORT_FAILED);
        }
        if (!keyFile.isPasswordProtected()) {
            return requireComplete(new RecipientKeyPair(keyFile.getPublicKey(), keyFile.getPrivateKey()));
        }
        if (password == null) {
            throw new KeyFileException(PASSWORD_REQUIRED);
        }

        byte[] key = null;
        try {
            byte[] salt = Base64.getDecoder().decode(keyFile.getSalt());
            byte[] iv = Base64.getDecoder().decode(keyFile.getIv());
            key = deriveKey(password, salt);
            Cipher cipher = Cipher.getInstance(AES_ALGO, "BC");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE, iv));
            byte[] plain = cipher.doFinal(Base64.getDecoder().decode(keyFile.getEncrypted()));
            RecipientKeyPair keyPair = mapper.readValue(plain, RecipientKeyPair.class);
            Arrays.fill(plain, (byte) 0);
            return requireComplete(keyPair);
        } catch (GeneralSecurityException | IOException | RuntimeException e) {
            log.debug("Key file import rejected", e);
            throw new KeyFileException(IMPORT_FAILED);
        } finally {
            if (key != null) {
                Arrays.fill(key, (byte) 0);
            }
        }
    }

    private byte[] deriveKey(char[] password, byte[] salt) {
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        byte[] passwordBytes = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(password);
        generator.init(passwordBytes, salt, PBKDF2_ITERATIONS);
        byte[] key = ((KeyParameter) generator.generateDerivedParameters(KEY_BITS)).getKey();
        Arrays.fill(passwordBytes, (byte) 0);
        return key;
    }

    private RecipientKeyPair requireComplete(RecipientKeyPair keyPair) {
        if (keyPair == null || isBlank(keyPair.getPublicKey()) || isBlank(keyPair.getPrivateKey())) {
            throw new KeyFileException(IMPORT_FAILED);
        }
        return keyPair;
    }

    private String write(KeyFile keyFile) {
        try {
            return mapper.writeValueAsString(keyFile);
        } catch (JsonProcessingException e) {
            throw new EncryptionFailureException("Failed to serialize key file", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

}
