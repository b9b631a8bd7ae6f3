package com.sommerph.zkinbox.service.encryption;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.zkinbox.model.encryption.KeyValidation;
import com.sommerph.zkinbox.util.HashUtils;
import com.sommerph.zkinbox.util.HexUtils;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.*;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes P-256 keys as Base64 of a JWK JSON object
 * ({@code {"kty":"EC","crv":"P-256","x":..,"y":..}}, plus {@code d} for private keys).
 */
@Slf4j
@Component
public class JwkKeyCodec {

    public static final String KEY_TYPE = "EC";
    public static final String CURVE = "P-256";
    private static final String CURVE_OID_NAME = "secp256r1";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ECNamedCurveParameterSpec curveSpec = ECNamedCurveTable.getParameterSpec(CURVE_OID_NAME);

    public ECGenParameterSpec generationSpec() {
        return new ECGenParameterSpec(CURVE_OID_NAME);
    }

    public String encodePublicKey(PublicKey publicKey) {
        ECPublicKey ecKey = (ECPublicKey) publicKey;
        Map<String, String> jwk = new LinkedHashMap<>();
        jwk.put("kty", KEY_TYPE);
        jwk.put("crv", CURVE);
        jwk.put("x", HashUtils.base64url(HexUtils.toFixedBytes(ecKey.getW().getAffineX())));
        jwk.put("y", HashUtils.base64url(HexUtils.toFixedBytes(ecKey.getW().getAffineY())));
        return toBase64Json(jwk);
    }

    public String encodePrivateKey(PrivateKey privateKey, PublicKey publicKey) {
        ECPublicKey ecPublic = (ECPublicKey) publicKey;
        Map<String, String> jwk = new LinkedHashMap<>();
        jwk.put("kty", KEY_TYPE);
        jwk.put("crv", CURVE);
        jwk.put("x", HashUtils.base64url(HexUtils.toFixedBytes(ecPublic.getW().getAffineX())));
        jwk.put("y", HashUtils.base64url(HexUtils.toFixedBytes(ecPublic.getW().getAffineY())));
        jwk.put("d", HashUtils.base64url(HexUtils.toFixedBytes(((ECPrivateKey) privateKey).getS())));
        return toBase64Json(jwk);
    }

    /**
     * Full validation of a serialized recipient key, reporting the first problem found.
     */
    public KeyValidation validatePublicKey(String base64Jwk) {
        if (base64Jwk == null || base64Jwk.isBlank()) {
            return KeyValidation.invalid("Public key is required");
        }
        JsonNode jwk;
        try {
            jwk = mapper.readTree(Base64.getDecoder().decode(base64Jwk.trim()));
        } catch (IllegalArgumentException | IOException e) {
            return KeyValidation.invalid("Invalid public key format");
        }
        if (jwk == null || !jwk.isObject()) {
            return KeyValidation.invalid("Invalid key structure");
        }
        if (!KEY_TYPE.equals(jwk.path("kty").asText(null))) {
            return KeyValidation.invalid("Invalid key type, expected EC");
        }
        if (!CURVE.equals(jwk.path("crv").asText(null))) {
            return KeyValidation.invalid("Invalid curve, expected P-256");
        }
        if (!jwk.hasNonNull("x") || !jwk.hasNonNull("y")) {
            return KeyValidation.invalid("Missing key coordinates (x, y)");
        }
        try {
            toPublicKey(jwk);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return KeyValidation.invalid("Public key cannot be imported");
        }
        return KeyValidation.ok();
    }

    /**
     * @throws GeneralSecurityException if the key is malformed or not a point on P-256
     */
    public PublicKey decodePublicKey(String base64Jwk) throws GeneralSecurityException {
        return toPublicKey(readJwk(base64Jwk));
    }

    public PrivateKey decodePrivateKey(String base64Jwk) throws GeneralSecurityException {
        JsonNode jwk = readJwk(base64Jwk);
        if (!jwk.hasNonNull("d")) {
            throw new InvalidKeySpecException("JWK has no private component");
        }
        BigInteger d = coordinate(jwk, "d");
        if (d.signum() <= 0 || d.compareTo(curveSpec.getN()) >= 0) {
            throw new InvalidKeySpecException("Private scalar out of range");
        }
        return KeyFactory.getInstance("EC", "BC").generatePrivate(new ECPrivateKeySpec(d, parameterSpec()));
    }

    private PublicKey toPublicKey(JsonNode jwk) throws GeneralSecurityException {
        if (!KEY_TYPE.equals(jwk.path("kty").asText(null)) || !CURVE.equals(jwk.path("crv").asText(null))) {
            throw new InvalidKeySpecException("Not a P-256 EC key");
        }
        BigInteger x = coordinate(jwk, "x");
        BigInteger y = coordinate(jwk, "y");
        try {
            // Rejects points that are off the curve or at infinity.
            curveSpec.getCurve().validatePoint(x, y);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("Point is not on P-256", e);
        }
        ECPublicKeySpec spec = new ECPublicKeySpec(new ECPoint(x, y), parameterSpec());
        return KeyFactory.getInstance("EC", "BC").generatePublic(spec);
    }

    private JsonNode readJwk(String base64Jwk) throws InvalidKeySpecException {
        if (base64Jwk == null) {
            throw new InvalidKeySpecException("Key is missing");
        }
        try {
            JsonNode jwk = mapper.readTree(Base64.getDecoder().decode(base64Jwk.trim()));
            if (jwk == null || !jwk.isObject()) {
                throw new InvalidKeySpecException("JWK is not a JSON object");
            }
            return jwk;
        } catch (IllegalArgumentException | IOException e) {
            throw new InvalidKeySpecException("Unreadable JWK", e);
        }
    }

    private BigInteger coordinate(JsonNode jwk, String field) throws InvalidKeySpecException {
        if (!jwk.hasNonNull(field)) {
            throw new InvalidKeySpecException("JWK field " + field + " is missing");
        }
        try {
            byte[] bytes = HashUtils.fromBase64url(jwk.get(field).asText());
            if (bytes.length == 0 || bytes.length > HexUtils.SCALAR_BYTES) {
                throw new InvalidKeySpecException("Bad length for JWK field " + field);
            }
            return new BigInteger(1, bytes);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("JWK field " + field + " is not base64url", e);
        }
    }

    private ECParameterSpec parameterSpec() throws GeneralSecurityException {
        AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC");
        parameters.init(generationSpec());
        return parameters.getParameterSpec(ECParameterSpec.class);
    }

    private String toBase64Json(Map<String, String> jwk) {
        try {
            return Base64.getEncoder().encodeToString(mapper.writeValueAsString(jwk).getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JWK", e);
        }
    }

}
