package com.sommerph.zkinbox.repository.submission;

import com.sommerph.zkinbox.model.submission.StoredSubmission;
import com.sommerph.zkinbox.model.submission.SubmissionPage;
import com.sommerph.zkinbox.model.submission.SubmissionStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemorySubmissionRegistry implements SubmissionRegistry {

    public static final int MAX_PAGE_SIZE = 100;

    private final Map<String, StoredSubmission> submissionStore = new ConcurrentHashMap<>();
    private final LinkedList<String> index = new LinkedList<>();

    @Override
    public void save(StoredSubmission submission) {
        log.info("Save submission {}", submission.getId());
        synchronized (index) {
            if (submissionStore.putIfAbsent(submission.getId(), copyOf(submission)) != null) {
                throw new IllegalStateException("Submission already exists: " + submission.getId());
            }
            index.addFirst(submission.getId());
        }
    }

    @Override
    public StoredSubmission load(String id) {
        log.info("Load submission {}", id);
        StoredSubmission submission = submissionStore.get(id);
        return submission == null ? null : copyOf(submission);
    }

    @Override
    public boolean exists(String id) {
        return submissionStore.containsKey(id);
    }

    @Override
    public SubmissionPage list(int limit, String cursor) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        List<String> ids;
        synchronized (index) {
            ids = new ArrayList<>(index);
        }
        int start = 0;
        if (cursor != null) {
            int position = ids.indexOf(cursor);
            start = position < 0 ? ids.size() : position + 1;
        }
        int end = Math.min(start + pageSize, ids.size());
        List<StoredSubmission> page = new ArrayList<>(end - start);
        for (String id : ids.subList(start, end)) {
            page.add(copyOf(submissionStore.get(id)));
        }
        String nextCursor = end < ids.size() ? ids.get(end - 1) : null;
        return new SubmissionPage(page, nextCursor, ids.size());
    }

    @Override
    public boolean updateStatus(String id, SubmissionStatus status) {
        StoredSubmission updated = submissionStore.computeIfPresent(id, (key, current) -> current.toBuilder()
                .status(status)
                .updatedAt(Instant.now().toString())
                .build());
        log.info("Update submission {} to {}: {}", id, status.value(), updated != null ? "done" : "not found");
        return updated != null;
    }

    // Callers never hold the stored instance.
    private static StoredSubmission copyOf(StoredSubmission submission) {
        return submission.toBuilder()
                .proofPublicSignals(submission.getProofPublicSignals() == null
                        ? null : List.copyOf(submission.getProofPublicSignals()))
                .build();
    }

}
