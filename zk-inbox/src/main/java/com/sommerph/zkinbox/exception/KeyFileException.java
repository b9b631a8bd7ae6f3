package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;

/** Key file could not be read; wrong password and corrupted file are not told apart. */
public class KeyFileException extends InboxException {

    public KeyFileException(String message) {
        super(RejectionReason.ENCRYPTION_FAILED, message);
    }

}
