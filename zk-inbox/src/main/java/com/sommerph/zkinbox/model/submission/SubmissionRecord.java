package com.sommerph.zkinbox.model.submission;

import com.sommerph.zkinbox.model.encryption.EncryptedEnvelope;
import com.sommerph.zkinbox.model.proof.ProofEnvelope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionRecord {

    private String id;
    private EncryptedEnvelope encryptedData;
    private ProofEnvelope proof;
    private long timestamp;     // unix millis
    private SubmissionStatus status;

}
