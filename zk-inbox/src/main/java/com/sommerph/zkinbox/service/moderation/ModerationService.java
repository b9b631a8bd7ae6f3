package com.sommerph.zkinbox.service.moderation;

import com.sommerph.zkinbox.model.submission.StoredSubmission;
import com.sommerph.zkinbox.model.submission.SubmissionPage;
import com.sommerph.zkinbox.model.submission.SubmissionStatus;
import com.sommerph.zkinbox.repository.submission.SubmissionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.NoSuchElementException;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationService {

    private final SubmissionRegistry submissionRegistry;

    public void updateStatus(String submissionId, SubmissionStatus status) {
        log.info("Set status of submission {} to {}", submissionId, status.value());
        if (!submissionRegistry.updateStatus(submissionId, status)) {
            throw new NoSuchElementException("Submission not found: " + submissionId);
        }
    }

    public void updateStatus(String submissionId, String status) {
        updateStatus(submissionId, SubmissionStatus.fromValue(status));
    }

    public StoredSubmission getSubmission(String submissionId) {
        StoredSubmission submission = submissionRegistry.load(submissionId);
        if (submission == null) {
            throw new NoSuchElementException("Submission not found: " + submissionId);
        }
        return submission;
    }

    public SubmissionPage listSubmissions(int limit, String cursor) {
        return submissionRegistry.list(limit, cursor);
    }

}
