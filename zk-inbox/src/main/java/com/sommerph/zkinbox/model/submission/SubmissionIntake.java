package com.sommerph.zkinbox.model.submission;

import com.sommerph.zkinbox.model.encryption.EncryptedEnvelope;
import com.sommerph.zkinbox.model.proof.ProofEnvelope;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A submission built by the client, received for verification and registration. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionIntake {

    @NotNull
    private EncryptedEnvelope encryptedData;

    @NotNull
    private ProofEnvelope proof;

    @NotNull
    private Long timestamp;

}
