package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;

/** Epoch outside the accepted window (current or previous epoch). */
public class InvalidEpochException extends ProofVerificationException {

    public InvalidEpochException(String message) {
        super(RejectionReason.INVALID_EPOCH, message);
    }

}
