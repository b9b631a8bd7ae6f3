package com.sommerph.zkinbox.model.submission;

import lombok.Value;

import java.util.List;

@Value
public class SubmissionResult {

    public static final String DUPLICATE_MESSAGE =
            "You have already submitted a report in this epoch. Please wait for the next epoch.";
    public static final String GENERIC_FAILURE_MESSAGE = "Submission failed, please retry later.";

    SubmissionState state;
    SubmissionRecord record;
    RejectionReason reason;
    List<SubmissionState> trail;

    public static SubmissionResult accepted(SubmissionRecord record, List<SubmissionState> trail) {
        return new SubmissionResult(SubmissionState.ACCEPTED, record, null, List.copyOf(trail));
    }

    public static SubmissionResult rejected(RejectionReason reason, List<SubmissionState> trail) {
        return new SubmissionResult(SubmissionState.REJECTED, null, reason, List.copyOf(trail));
    }

    public boolean isAccepted() {
        return state == SubmissionState.ACCEPTED;
    }

    /** What the submitter may be told; hides which check failed unless it was a duplicate. */
    public String userMessage() {
        if (isAccepted()) {
            return "Report submitted";
        }
        return reason.isUserVisible() ? DUPLICATE_MESSAGE : GENERIC_FAILURE_MESSAGE;
    }

}
