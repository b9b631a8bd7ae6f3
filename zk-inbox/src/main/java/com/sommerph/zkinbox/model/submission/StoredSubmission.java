package com.sommerph.zkinbox.model.submission;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Shape handed to the report store: the envelope is kept as its JSON string and only
 * the public signals of the proof are retained.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StoredSubmission {

    private String id;
    private String encryptedData;
    private List<String> proofPublicSignals;   // [root, epoch, nullifier, signalHash]
    private long timestamp;
    private SubmissionStatus status;
    private String createdAt;
    private String updatedAt;

}
