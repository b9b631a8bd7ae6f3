package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;

/** Wrong key, tampered ciphertext and bad tag all surface with the same message. */
public class DecryptionFailureException extends InboxException {

    public DecryptionFailureException(String message) {
        super(RejectionReason.ENCRYPTION_FAILED, message);
    }

    public DecryptionFailureException(String message, Throwable cause) {
        super(RejectionReason.ENCRYPTION_FAILED, message, cause);
    }

}
