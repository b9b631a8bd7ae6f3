package com.sommerph.zkinbox.model.submission;

import com.sommerph.zkinbox.model.identity.Identity;
import com.sommerph.zkinbox.model.merkle.MerkleProof;
import lombok.Builder;
import lombok.Value;

/** Everything the submitter side supplies to build one submission. */
@Value
@Builder
public class SubmissionRequest {

    Identity identity;
    MerkleProof merkleProof;
    long epoch;
    String recipientPublicKey;
    byte[] payload;

}
