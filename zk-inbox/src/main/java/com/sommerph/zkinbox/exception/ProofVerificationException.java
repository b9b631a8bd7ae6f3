package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;

public class ProofVerificationException extends InboxException {

    public ProofVerificationException(String message) {
        super(RejectionReason.PROOF_VERIFICATION_FAILED, message);
    }

    protected ProofVerificationException(RejectionReason reason, String message) {
        super(reason, message);
    }

}
