package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;

public class ProofGenerationException extends InboxException {

    public ProofGenerationException(String message) {
        super(RejectionReason.PROOF_GENERATION_FAILED, message);
    }

    public ProofGenerationException(String message, Throwable cause) {
        super(RejectionReason.PROOF_GENERATION_FAILED, message, cause);
    }

}
