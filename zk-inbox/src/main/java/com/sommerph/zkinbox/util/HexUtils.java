package com.sommerph.zkinbox.util;

import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.regex.Pattern;

public class HexUtils {

    public static final int SCALAR_BYTES = 32;

    private static final Pattern FIXED_HEX_SCALAR = Pattern.compile("^0x[0-9a-f]{64}$");

    /**
     * Renders a non-negative scalar as {@code 0x} followed by exactly 64 lowercase hex digits.
     */
    public static String toFixedHex(BigInteger scalar) {
        return "0x" + Hex.toHexString(toFixedBytes(scalar));
    }

    public static boolean isFixedHexScalar(String value) {
        return value != null && FIXED_HEX_SCALAR.matcher(value).matches();
    }

    public static BigInteger parseFixedHex(String value) {
        if (!isFixedHexScalar(value)) {
            throw new IllegalArgumentException("Not a fixed-length hex scalar: " + value);
        }
        return new BigInteger(value.substring(2), 16);
    }

    /**
     * Unsigned big-endian encoding left-padded to 32 bytes. Sign bytes from
     * {@link BigInteger#toByteArray()} are dropped.
     */
    public static byte[] toFixedBytes(BigInteger scalar) {
        if (scalar.signum() < 0 || scalar.bitLength() > SCALAR_BYTES * 8) {
            throw new IllegalArgumentException("Scalar does not fit in " + SCALAR_BYTES + " bytes");
        }
        return leftPadTo32Bytes(scalar.toByteArray());
    }

    private static byte[] leftPadTo32Bytes(byte[] bytes) {
        if (bytes.length == SCALAR_BYTES) return bytes;
        byte[] padded = new byte[SCALAR_BYTES];
        int srcPos = Math.max(0, bytes.length - SCALAR_BYTES);
        int destPos = SCALAR_BYTES - (bytes.length - srcPos);
        int length = bytes.length - srcPos;
        System.arraycopy(bytes, srcPos, padded, destPos, length);
        return padded;
    }

}
