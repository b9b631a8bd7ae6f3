package com.sommerph.zkinbox.util;

import org.bouncycastle.crypto.digests.SHA256Digest;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

public class HashUtils {

    // Leading digest bytes kept when a digest is mapped into the field; 31 bytes stay below the BN254 modulus.
    private static final int FIELD_SAFE_BYTES = 31;

    public static byte[] sha256(byte[] input) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    public static byte[] sha256(String input) {
        return sha256(input.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * SHA-256 of the message truncated to its first 31 bytes, read as an unsigned integer.
     * Used to bind a payload to a proof's signal without revealing it.
     */
    public static BigInteger messageHash(byte[] message) {
        byte[] digest = sha256(message);
        return new BigInteger(1, Arrays.copyOf(digest, FIELD_SAFE_BYTES));
    }

    public static String base64url(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    public static byte[] fromBase64url(String data) {
        return Base64.getUrlDecoder().decode(data);
    }

}
