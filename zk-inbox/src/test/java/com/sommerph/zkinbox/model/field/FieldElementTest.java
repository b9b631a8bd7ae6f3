package com.sommerph.zkinbox.model.field;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class FieldElementTest {

    @Test
    void reducesModuloTheScalarField() {
        assertEquals(FieldElement.ZERO, FieldElement.of(FieldElement.MODULUS));
        assertEquals(FieldElement.ONE, FieldElement.of(FieldElement.MODULUS.add(BigInteger.ONE)));
        assertEquals(FieldElement.of(FieldElement.MODULUS.subtract(BigInteger.ONE)), FieldElement.of(-1));
    }

    @Test
    void arithmeticWrapsAroundTheModulus() {
        FieldElement max = FieldElement.of(FieldElement.MODULUS.subtract(BigInteger.ONE));
        assertEquals(FieldElement.ZERO, max.add(FieldElement.ONE));
        assertEquals(max, FieldElement.ZERO.sub(FieldElement.ONE));
        assertEquals(FieldElement.ONE, max.mul(max));
        assertEquals(FieldElement.of(243), FieldElement.of(3).pow(5));
        assertTrue(FieldElement.ZERO.isZero());
    }

    @Test
    void parsesDecimalAndHex() {
        assertEquals(FieldElement.of(255), FieldElement.parse("255"));
        assertEquals(FieldElement.of(255), FieldElement.parse("0xff"));
        assertEquals(FieldElement.of(255), FieldElement.parse(" 0XFF "));
        assertThrows(NumberFormatException.class, () -> FieldElement.parse(""));
        assertThrows(NumberFormatException.class, () -> FieldElement.parse("abc"));
    }

    @Test
    void rendersFixedWidthHex() {
        String hex = FieldElement.of(1).toHex();
        assertEquals(66, hex.length());
        assertTrue(hex.startsWith("0x000"));
        assertTrue(hex.endsWith("01"));
    }

    @Test
    void serializesAsDecimalString() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("\"42\"", mapper.writeValueAsString(FieldElement.of(42)));
        assertEquals(FieldElement.of(42), mapper.readValue("\"42\"", FieldElement.class));
    }

}
