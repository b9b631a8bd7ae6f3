package com.sommerph.zkinbox.exception;

import com.sommerph.zkinbox.model.submission.RejectionReason;
import lombok.Getter;

/**
 * Base of the submission error taxonomy. Each subtype maps to the
 * {@link RejectionReason} the pipeline reports for it.
 */
@Getter
public abstract class InboxException extends RuntimeException {

    private final RejectionReason reason;

    protected InboxException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected InboxException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

}
