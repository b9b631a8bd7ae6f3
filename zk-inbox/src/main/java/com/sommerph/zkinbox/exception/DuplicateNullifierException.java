package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;

/** The (epoch, nullifier) pair has already been registered. */
public class DuplicateNullifierException extends InboxException {

    public DuplicateNullifierException(String message) {
        super(RejectionReason.DUPLICATE_NULLIFIER, message);
    }

    public DuplicateNullifierException(String message, Throwable cause) {
        super(RejectionReason.DUPLICATE_NULLIFIER, message, cause);
    }

}
