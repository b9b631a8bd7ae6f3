package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;

/** Recipient public key is not a P-256 JWK that imports as a valid curve point. */
public class InvalidRecipientKeyException extends InboxException {

    public InvalidRecipientKeyException(String message) {
        super(RejectionReason.ENCRYPTION_FAILED, message);
    }

    public InvalidRecipientKeyException(String message, Throwable cause) {
        super(RejectionReason.ENCRYPTION_FAILED, message, cause);
    }

}
