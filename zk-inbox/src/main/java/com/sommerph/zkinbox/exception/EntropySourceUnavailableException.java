package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;

public class EntropySourceUnavailableException extends InboxException {

    public EntropySourceUnavailableException(String message) {
        super(RejectionReason.PROOF_GENERATION_FAILED, message);
    }

    public EntropySourceUnavailableException(String message, Throwable cause) {
        super(RejectionReason.PROOF_GENERATION_FAILED, message, cause);
    }

}
