package com.sommerph.zkinbox.model.merkle;

import com.sommerph.zkinbox.model.field.FieldElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inclusion path of a leaf. {@code pathIndices[i]} is 0 when the running node is the
 * left child at level i and 1 when it is the right child; {@code pathElements[i]} is
 * its sibling at that level.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MerkleProof {

    private FieldElement root;
    private List<FieldElement> pathElements;
    private List<Integer> pathIndices;

    public int depth() {
        return pathElements == null ? 0 : pathElements.size();
    }

}
