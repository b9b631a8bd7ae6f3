package com.sommerph.zkinbox.service.proof;

import com.sommerph.zkinbox.config.InboxProperties;
import com.sommerph.zkinbox.exception.ProofVerificationException;
import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.proof.ProofEnvelope;
import com.sommerph.zkinbox.service.group.GroupMembershipProvider;
import com.sommerph.zkinbox.service.nullifier.NullifierService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Intake-side checks on top of {@link ProofSystem#verify}: freshness of the proof epoch
 * and the submission timestamp, and that the proof was made against a known group root.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProofVerificationService {

    private final ProofSystem proofSystem;
    private final NullifierService nullifierService;
    private final GroupMembershipProvider groupMembershipProvider;
    private final InboxProperties properties;
    private final Clock clock;

    /**
     * @param timestampMillis submission wall-clock time in unix milliseconds
     * @throws ProofVerificationException on any failed check
     */
    public void verifySubmission(ProofEnvelope envelope, long timestampMillis) {
        if (!proofSystem.verify(envelope)) {
            throw new ProofVerificationException("Proof envelope failed verification");
        }

        long nowMillis = clock.millis();
        long durationMillis = properties.getEpoch().getDurationSeconds() * 1000L;
        long skewMillis = properties.getEpoch().getClockSkewSeconds() * 1000L;
        if (timestampMillis < 0) {
            throw new ProofVerificationException("Submission timestamp is negative");
        }
        if (timestampMillis > nowMillis + skewMillis) {
            throw new ProofVerificationException("Submission timestamp is in the future");
        }
        if (timestampMillis < nowMillis - durationMillis) {
            throw new ProofVerificationException("Submission timestamp is older than one epoch");
        }

        long proofEpoch = Long.parseLong(envelope.epochSignal());
        long currentEpoch = nullifierService.currentEpoch();
        if (proofEpoch > currentEpoch) {
            throw new ProofVerificationException("Proof epoch " + proofEpoch + " is in the future");
        }
        if (proofEpoch < currentEpoch - 1) {
            throw new ProofVerificationException("Proof epoch " + proofEpoch + " is stale, current epoch is " + currentEpoch);
        }

        if (properties.getProof().isEnforceGroupRoot()
                && !groupMembershipProvider.isAcceptedRoot(FieldElement.parse(envelope.rootSignal()))) {
            throw new ProofVerificationException("Proof root is not a recent group root");
        }
        log.info("Proof verified for epoch {}", proofEpoch);
    }

}
