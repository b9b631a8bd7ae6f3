package com.sommerph.zkinbox.repository.submission;

import com.sommerph.zkinbox.model.submission.StoredSubmission;
import com.sommerph.zkinbox.model.submission.SubmissionPage;
import com.sommerph.zkinbox.model.submission.SubmissionStatus;

public interface SubmissionRegistry {

    void save(StoredSubmission submission);

    StoredSubmission load(String id);

    boolean exists(String id);

    /** Newest first; {@code cursor} is the id of the last entry of the previous page. */
    SubmissionPage list(int limit, String cursor);

    /**
     * @return false if no submission has this id
     */
    boolean updateStatus(String id, SubmissionStatus status);

}
