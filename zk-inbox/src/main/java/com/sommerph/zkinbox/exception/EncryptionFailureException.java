package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;

public class EncryptionFailureException extends InboxException {

    public EncryptionFailureException(String message) {
        super(RejectionReason.ENCRYPTION_FAILED, message);
    }

    public EncryptionFailureException(String message, Throwable cause) {
        super(RejectionReason.ENCRYPTION_FAILED, message, cause);
    }

}
