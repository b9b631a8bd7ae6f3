package com.sommerph.zkinbox.util;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class HexUtilsTest {

    @Test
    void fixedHexIsAlways64Digits() {
        String hex = HexUtils.toFixedHex(BigInteger.TWO.pow(255));
        assertEquals(66, hex.length());
        assertTrue(HexUtils.isFixedHexScalar(hex));
        assertEquals(BigInteger.TWO.pow(255), HexUtils.parseFixedHex(hex));
    }

    @Test
    void rejectsNonCanonicalHex() {
        assertFalse(HexUtils.isFixedHexScalar("0x1"));
        assertFalse(HexUtils.isFixedHexScalar("0X" + "0".repeat(64)));
        assertFalse(HexUtils.isFixedHexScalar("0x" + "A".repeat(64)));
        assertThrows(IllegalArgumentException.class, () -> HexUtils.parseFixedHex("12"));
        assertThrows(IllegalArgumentException.class, () -> HexUtils.toFixedBytes(BigInteger.ONE.negate()));
    }

    @Test
    void messageHashKeepsFirst31Bytes() {
        BigInteger hash = HashUtils.messageHash("hello".getBytes());
        assertTrue(hash.bitLength() <= 248);
        assertEquals(hash, HashUtils.messageHash("hello".getBytes()));
    }

}
