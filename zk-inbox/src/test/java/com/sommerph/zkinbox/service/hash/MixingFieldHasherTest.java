package com.sommerph.zkinbox.service.hash;

import com.sommerph.zkinbox.model.field.FieldElement;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MixingFieldHasherTest {

    private final FieldHasher hasher = new MixingFieldHasher();

    @Test
    void isDeterministic() {
        assertEquals(hasher.hash(FieldElement.of(1), FieldElement.of(2)),
                new MixingFieldHasher().hash(FieldElement.of(1), FieldElement.of(2)));
    }

    @Test
    void dependsOnOrderAndLength() {
        FieldElement a = FieldElement.of(7);
        FieldElement b = FieldElement.of(11);
        assertNotEquals(hasher.hash(a, b), hasher.hash(b, a));
        assertNotEquals(hasher.hash(a), hasher.hash(a, FieldElement.ZERO));
        assertNotEquals(hasher.hash(FieldElement.ZERO), hasher.hash(FieldElement.ZERO, FieldElement.ZERO));
    }

    @Test
    void varargsMatchesListForm() {
        assertEquals(hasher.hash(List.of(FieldElement.of(3), FieldElement.of(4))),
                hasher.hash(FieldElement.of(3), FieldElement.of(4)));
    }

    @Test
    void rejectsNullInputs() {
        assertThrows(IllegalArgumentException.class,
                () -> hasher.hash(Arrays.asList(FieldElement.ONE, null)));
    }

}
