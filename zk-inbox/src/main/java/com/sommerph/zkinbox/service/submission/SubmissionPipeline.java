package com.sommerph.zkinbox.service.submission;

import com.sommerph.zkinbox.exception.DuplicateNullifierException;
import com.sommerph.zkinbox.exception.InboxException;
import com.sommerph.zkinbox.exception.InvalidEpochException;
import com.sommerph.zkinbox.model.encryption.EncryptedEnvelope;
import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.proof.ProofEnvelope;
import com.sommerph.zkinbox.model.submission.RejectionReason;
import com.sommerph.zkinbox.model.submission.StoredSubmission;
import com.sommerph.zkinbox.model.submission.SubmissionIntake;
import com.sommerph.zkinbox.model.submission.SubmissionRecord;
import com.sommerph.zkinbox.model.submission.SubmissionRequest;
import com.sommerph.zkinbox.model.submission.SubmissionResult;
import com.sommerph.zkinbox.model.submission.SubmissionState;
import com.sommerph.zkinbox.model.submission.SubmissionStatus;
import com.sommerph.zkinbox.repository.submission.SubmissionRegistry;
import com.sommerph.zkinbox.service.encryption.HybridEncryptionService;
import com.sommerph.zkinbox.service.hash.FieldHasher;
import com.sommerph.zkinbox.service.merkle.MerkleTreeService;
import com.sommerph.zkinbox.service.nullifier.NullifierService;
import com.sommerph.zkinbox.service.proof.ProofSystem;
import com.sommerph.zkinbox.service.proof.ProofVerificationService;
import com.sommerph.zkinbox.util.HashUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives a submission through
 * BUILDING → PROOF_READY → ENCRYPTED → NULLIFIER_CHECKED → ACCEPTED,
 * or to REJECTED from any of them.
 *
 * <p>Business rejections are returned, not thrown. The calling thread's interrupt flag
 * is honoured up to the nullifier check; once a nullifier is registered the submission
 * either commits or the registration is released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionPipeline {

    private final NullifierService nullifierService;
    private final MerkleTreeService merkleTreeService;
    private final ProofSystem proofSystem;
    private final ProofVerificationService proofVerificationService;
    private final HybridEncryptionService encryptionService;
    private final FieldHasher hasher;
    private final SubmissionRegistry submissionRegistry;
    private final Clock clock;

    /** Builds the proof and envelope for a report, then accepts it. */
    public SubmissionResult submit(SubmissionRequest request) {
        List<SubmissionState> trail = new ArrayList<>();
        trail.add(SubmissionState.BUILDING);
        long epoch = request.getEpoch();
        log.info("Build submission for epoch {}", epoch);

        if (isCancelled()) {
            return reject(RejectionReason.CANCELLED, trail, null);
        }

        ProofEnvelope proof;
        try {
            checkEpoch(epoch);
            FieldElement commitment = request.getIdentity().getCommitment();
            if (!merkleTreeService.verifyMembership(commitment, request.getMerkleProof())) {
                return reject(RejectionReason.PROOF_GENERATION_FAILED, trail,
                        new IllegalArgumentException("Identity is not a member of the supplied tree"));
            }
            FieldElement nullifier = nullifierService.deriveNullifier(request.getIdentity().getSecret(), epoch);
            FieldElement signalHash = signalHash(request.getPayload());
            proof = proofSystem.generate(request.getMerkleProof(), epoch, nullifier, signalHash);
        } catch (InboxException e) {
            return reject(e.getReason(), trail, e);
        } catch (RuntimeException e) {
            return reject(RejectionReason.PROOF_GENERATION_FAILED, trail, e);
        }
        trail.add(SubmissionState.PROOF_READY);

        if (isCancelled()) {
            return reject(RejectionReason.CANCELLED, trail, null);
        }

        EncryptedEnvelope envelope;
        try {
            envelope = encryptionService.encrypt(request.getPayload(), request.getRecipientPublicKey());
        } catch (InboxException e) {
            return reject(RejectionReason.ENCRYPTION_FAILED, trail, e);
        }
        trail.add(SubmissionState.ENCRYPTED);

        return commit(proof, envelope, clock.millis(), trail);
    }

    /** Verifies and registers a submission that was built elsewhere. */
    public SubmissionResult accept(SubmissionIntake intake) {
        List<SubmissionState> trail = new ArrayList<>();
        trail.add(SubmissionState.ENCRYPTED);
        log.info("Accept client-built submission");
        if (intake == null || intake.getProof() == null || intake.getTimestamp() == null) {
            return reject(RejectionReason.PROOF_VERIFICATION_FAILED, trail,
                    new IllegalArgumentException("Submission is missing its proof or timestamp"));
        }
        return commit(intake.getProof(), intake.getEncryptedData(), intake.getTimestamp(), trail);
    }

    public FieldElement signalHash(byte[] payload) {
        return hasher.hash(FieldElement.of(HashUtils.messageHash(payload)));
    }

    private SubmissionResult commit(ProofEnvelope proof, EncryptedEnvelope envelope, long timestamp,
                                    List<SubmissionState> trail) {
        if (!encryptionService.isWellFormed(envelope)) {
            return reject(RejectionReason.MALFORMED_ENVELOPE, trail,
                    new IllegalArgumentException("Encrypted envelope is malformed"));
        }
        try {
            proofVerificationService.verifySubmission(proof, timestamp);
        } catch (InboxException e) {
            return reject(e.getReason(), trail, e);
        }

        if (isCancelled()) {
            return reject(RejectionReason.CANCELLED, trail, null);
        }

        long epoch = Long.parseLong(proof.epochSignal());
        FieldElement nullifier = FieldElement.parse(proof.nullifierSignal());
        try {
            nullifierService.registerIfUnused(nullifier, epoch);
        } catch (DuplicateNullifierException e) {
            return reject(RejectionReason.DUPLICATE_NULLIFIER, trail, e);
        } catch (RuntimeException e) {
            return reject(RejectionReason.PERSISTENCE_FAILED, trail, e);
        }
        trail.add(SubmissionState.NULLIFIER_CHECKED);

        SubmissionRecord record = SubmissionRecord.builder()
                .id(UUID.randomUUID().toString())
                .encryptedData(envelope)
                .proof(proof)
                .timestamp(timestamp)
                .status(SubmissionStatus.PENDING)
                .build();
        try {
            submissionRegistry.save(toStored(record));
        } catch (RuntimeException e) {
            nullifierService.release(nullifier, epoch);
            return reject(RejectionReason.PERSISTENCE_FAILED, trail, e);
        }

        trail.add(SubmissionState.ACCEPTED);
        log.info("Submission {} accepted for epoch {}", record.getId(), epoch);
        return SubmissionResult.accepted(record, trail);
    }

    private StoredSubmission toStored(SubmissionRecord record) {
        String now = Instant.now(clock).toString();
        return StoredSubmission.builder()
                .id(record.getId())
                .encryptedData(encryptionService.stringify(record.getEncryptedData()))
                .proofPublicSignals(List.copyOf(record.getProof().getPublicSignals()))
                .timestamp(record.getTimestamp())
                .status(record.getStatus())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void checkEpoch(long epoch) {
        long current = nullifierService.currentEpoch();
        if (epoch != current && epoch != current - 1) {
            throw new InvalidEpochException("Epoch " + epoch + " is neither current (" + current + ") nor previous");
        }
    }

    private boolean isCancelled() {
        return Thread.currentThread().isInterrupted();
    }

    private SubmissionResult reject(RejectionReason reason, List<SubmissionState> trail, Exception cause) {
        SubmissionState at = trail.get(trail.size() - 1);
        if (cause == null) {
            log.warn("Submission rejected after {}: {}", at, reason);
        } else {
            log.warn("Submission rejected after {}: {}", at, reason, cause);
        }
        trail.add(SubmissionState.REJECTED);
        return SubmissionResult.rejected(reason, trail);
    }

}
