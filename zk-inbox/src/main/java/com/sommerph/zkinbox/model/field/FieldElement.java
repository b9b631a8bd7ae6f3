package com.sommerph.zkinbox.model.field;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sommerph.zkinbox.util.HexUtils;
import lombok.EqualsAndHashCode;

import java.math.BigInteger;

/**
 * Element of the BN254 scalar field. Every constructor reduces modulo {@link #MODULUS},
 * so values are always in {@code [0, MODULUS)} and arithmetic wraps instead of overflowing.
 * Serialized as a decimal string, the way circuit public signals are written.
 */
@EqualsAndHashCode
public final class FieldElement implements Comparable<FieldElement> {

    public static final BigInteger MODULUS = new BigInteger(
            "21888242871839275222246405745257275088548364400416034343698204186575808495617");

    public static final FieldElement ZERO = new FieldElement(BigInteger.ZERO);
    public static final FieldElement ONE = new FieldElement(BigInteger.ONE);

    private final BigInteger value;

    private FieldElement(BigInteger value) {
        this.value = value.mod(MODULUS);
    }

    public static FieldElement of(BigInteger value) {
        return new FieldElement(value);
    }

    public static FieldElement of(long value) {
        return new FieldElement(BigInteger.valueOf(value));
    }

    /**
     * Parses a decimal or {@code 0x}-prefixed hex string.
     *
     * @throws NumberFormatException if the string is empty or not a number
     */
    @JsonCreator
    public static FieldElement parse(String text) {
        if (text == null || text.isBlank()) {
            throw new NumberFormatException("Empty field element");
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            return new FieldElement(new BigInteger(trimmed.substring(2), 16));
        }
        return new FieldElement(new BigInteger(trimmed));
    }

    public FieldElement add(FieldElement other) {
        return new FieldElement(value.add(other.value));
    }

    public FieldElement sub(FieldElement other) {
        return new FieldElement(value.subtract(other.value));
    }

    public FieldElement mul(FieldElement other) {
        return new FieldElement(value.multiply(other.value));
    }

    public FieldElement pow(long exponent) {
        return new FieldElement(value.modPow(BigInteger.valueOf(exponent), MODULUS));
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public BigInteger toBigInteger() {
        return value;
    }

    /** 0x-prefixed, 64 hex digits. */
    public String toHex() {
        return HexUtils.toFixedHex(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value.toString();
    }

    @Override
    public int compareTo(FieldElement other) {
        return value.compareTo(other.value);
    }

}
