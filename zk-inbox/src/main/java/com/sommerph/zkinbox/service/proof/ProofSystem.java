package com.sommerph.zkinbox.service.proof;

import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.merkle.MerkleProof;
import com.sommerph.zkinbox.model.proof.ProofEnvelope;

/**
 * Prover/verifier seam. A real SNARK backend implements this interface with the same
 * envelope shape and public-signal order.
 */
public interface ProofSystem {

    /**
     * @throws com.sommerph.zkinbox.exception.ProofGenerationException if the inputs cannot be proven
     */
    ProofEnvelope generate(MerkleProof merkleProof, long epoch, FieldElement nullifier, FieldElement signalHash);

    /**
     * Never throws for malformed input; every failure is reported as {@code false}.
     */
    boolean verify(ProofEnvelope envelope);

}
