package com.sommerph.zkinbox.service.hash;

import com.sommerph.zkinbox.model.field.FieldElement;

import java.util.Arrays;
import java.util.List;

/**
 * Deterministic, order-sensitive hash of field elements into one field element.
 * Merkle tree, nullifier and proof code depend only on this contract, so a Poseidon
 * or Rescue permutation can replace the default implementation.
 */
public interface FieldHasher {

    FieldElement hash(List<FieldElement> inputs);

    default FieldElement hash(FieldElement... inputs) {
        return hash(Arrays.asList(inputs));
    }

}
