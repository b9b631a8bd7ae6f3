package com.sommerph.zkinbox.service.hash;

import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.util.HashUtils;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * Sponge-shaped stand-in for Poseidon: absorbs each input with a round constant and
 * an x^5 S-box, then runs a few finalisation rounds. It is deterministic and
 * non-commutative but has not been analysed as a cryptographic hash.
 */
@Component
public class MixingFieldHasher implements FieldHasher {

    private static final int CONSTANTS = 16;
    private static final int FINAL_ROUNDS = 4;
    private static final long SBOX_EXPONENT = 5;
    private static final FieldElement MIX = FieldElement.of(31);

    private static final FieldElement[] ROUND_CONSTANTS = roundConstants();

    @Override
    public FieldElement hash(List<FieldElement> inputs) {
        // Length is absorbed first so [a] and [a, 0] never collide trivially.
        FieldElement state = FieldElement.of(inputs.size()).add(ROUND_CONSTANTS[0]);
        for (int i = 0; i < inputs.size(); i++) {
            FieldElement input = inputs.get(i);
            if (input == null) {
                throw new IllegalArgumentException("Null input at position " + i);
            }
            state = sbox(state.add(input).add(constant(i + 1))).mul(MIX);
        }
        for (int r = 0; r < FINAL_ROUNDS; r++) {
            state = sbox(state.add(constant(inputs.size() + r + 1)));
        }
        return state;
    }

    private static FieldElement sbox(FieldElement value) {
        return value.pow(SBOX_EXPONENT);
    }

    private static FieldElement constant(int index) {
        return ROUND_CONSTANTS[index % CONSTANTS];
    }

    private static FieldElement[] roundConstants() {
        FieldElement[] constants = new FieldElement[CONSTANTS];
        for (int i = 0; i < CONSTANTS; i++) {
            byte[] digest = HashUtils.sha256("zk-inbox/mixing-hasher/round-" + i);
            constants[i] = FieldElement.of(new BigInteger(1, digest));
        }
        return constants;
    }

}
