package com.sommerph.zkinbox.model.submission;

/**
 * Terminal rejection causes of a submission.
 * Only {@link #DUPLICATE_NULLIFIER} may be shown to the submitter as-is;
 * every other reason is reported to them as a generic failure.
 */
public enum RejectionReason {

    INVALID_EPOCH,
    PROOF_GENERATION_FAILED,
    ENCRYPTION_FAILED,
    PROOF_VERIFICATION_FAILED,
    MALFORMED_ENVELOPE,
    DUPLICATE_NULLIFIER,
    CANCELLED,
    PERSISTENCE_FAILED;

    public boolean isUserVisible() {
        return this == DUPLICATE_NULLIFIER;
    }

}
