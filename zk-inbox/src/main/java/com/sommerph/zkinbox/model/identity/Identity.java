package com.sommerph.zkinbox.model.identity;

import com.sommerph.zkinbox.model.field.FieldElement;
import lombok.Value;

/**
 * Submitter identity. The secret stays in the submitter's runtime; only the
 * commitment is published as a Merkle leaf.
 */
@Value
public class Identity {

    FieldElement secret;
    FieldElement commitment;

    @Override
    public String toString() {
        return "Identity(commitment=" + commitment + ")";
    }

}
