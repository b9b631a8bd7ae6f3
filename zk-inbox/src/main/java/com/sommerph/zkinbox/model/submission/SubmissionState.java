package com.sommerph.zkinbox.model.submission;

/** Pipeline stages; ACCEPTED and REJECTED are terminal. */
public enum SubmissionState {

    BUILDING,
    PROOF_READY,
    ENCRYPTED,
    NULLIFIER_CHECKED,
    ACCEPTED,
    REJECTED

}
