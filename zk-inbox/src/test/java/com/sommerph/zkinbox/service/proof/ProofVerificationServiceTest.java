package com.sommerph.zkinbox.service.proof;

import com.sommerph.zkinbox.InboxFixture;
import com.sommerph.zkinbox.exception.ProofVerificationException;
import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.identity.Identity;
import com.sommerph.zkinbox.model.merkle.MerkleProof;
import com.sommerph.zkinbox.model.merkle.MerkleTree;
import com.sommerph.zkinbox.model.proof.ProofEnvelope;
import com.sommerph.zkinbox.model.submission.RejectionReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.sommerph.zkinbox.InboxFixture.EPOCH;
import static com.sommerph.zkinbox.InboxFixture.EPOCH_SECONDS;
import static org.junit.jupiter.api.Assertions.*;

class ProofVerificationServiceTest {

    private InboxFixture fixture;
    private ProofVerificationService verificationService;
    private Identity identity;

    @BeforeEach
    void setup() {
        fixture = new InboxFixture().withMembers(5);
        verificationService = fixture.verificationService;
        identity = fixture.member(0);
    }

    private ProofEnvelope proofFor(long epoch) {
        MerkleProof merkleProof = fixture.group.proveMembership(identity.getCommitment());
        return proofFor(merkleProof, epoch);
    }

    private ProofEnvelope proofFor(MerkleProof merkleProof, long epoch) {
        FieldElement nullifier = fixture.nullifierService.deriveNullifier(identity.getSecret(), epoch);
        return fixture.proofSystem.generate(merkleProof, epoch, nullifier, FieldElement.of(1));
    }

    @Test
    void acceptsCurrentAndPreviousEpoch() {
        long now = fixture.clock.millis();
        assertDoesNotThrow(() -> verificationService.verifySubmission(proofFor(EPOCH), now));
        assertDoesNotThrow(() -> verificationService.verifySubmission(proofFor(EPOCH - 1), now));
    }

    @Test
    void rejectsStaleAndFutureEpochs() {
        long now = fixture.clock.millis();
        ProofVerificationException stale = assertThrows(ProofVerificationException.class,
                () -> verificationService.verifySubmission(proofFor(EPOCH - 2), now));
        assertEquals(RejectionReason.PROOF_VERIFICATION_FAILED, stale.getReason());
        assertThrows(ProofVerificationException.class,
                () -> verificationService.verifySubmission(proofFor(EPOCH + 1), now));
    }

    @Test
    void proofFromCurrentEpochGoesStaleTwoEpochsLater() {
        ProofEnvelope proof = proofFor(EPOCH);
        fixture.clock.advance(Duration.ofSeconds(2 * EPOCH_SECONDS));
        long now = fixture.clock.millis();
        assertThrows(ProofVerificationException.class, () -> verificationService.verifySubmission(proof, now));
    }

    @Test
    void enforcesTimestampWindow() {
        ProofEnvelope proof = proofFor(EPOCH);
        long now = fixture.clock.millis();
        assertDoesNotThrow(() -> verificationService.verifySubmission(proof, now + 10_000));
        assertThrows(ProofVerificationException.class,
                () -> verificationService.verifySubmission(proof, now + 60_000));
        assertThrows(ProofVerificationException.class,
                () -> verificationService.verifySubmission(proof, now - EPOCH_SECONDS * 1000 - 1));
    }

    @Test
    void rejectsNegativeAndEpochZeroTimestamps() {
        ProofEnvelope proof = proofFor(EPOCH);
        assertThrows(ProofVerificationException.class,
                () -> verificationService.verifySubmission(proof, Long.MIN_VALUE));
        assertThrows(ProofVerificationException.class,
                () -> verificationService.verifySubmission(proof, -1));
        assertThrows(ProofVerificationException.class,
                () -> verificationService.verifySubmission(proof, 0));
    }

    @Test
    void rejectsRootOutsideGroupHistory() {
        MerkleTree foreign = fixture.merkleTreeService.build(List.of(identity.getCommitment(), FieldElement.of(5)));
        ProofEnvelope proof = proofFor(fixture.merkleTreeService.proveMembership(foreign, 0), EPOCH);
        long now = fixture.clock.millis();
        assertThrows(ProofVerificationException.class, () -> verificationService.verifySubmission(proof, now));

        fixture.properties.getProof().setEnforceGroupRoot(false);
        assertDoesNotThrow(() -> verificationService.verifySubmission(proof, now));
    }

    @Test
    void recentRootStaysAcceptedAfterGroupGrows() {
        ProofEnvelope proof = proofFor(EPOCH);
        fixture.withMembers(1);
        assertDoesNotThrow(() -> verificationService.verifySubmission(proof, fixture.clock.millis()));
    }

    @Test
    void rejectsTamperedProof() {
        ProofEnvelope proof = proofFor(EPOCH);
        proof.setPi_c(List.of(proof.getPi_c().get(1), proof.getPi_c().get(0)));
        assertThrows(ProofVerificationException.class,
                () -> verificationService.verifySubmission(proof, fixture.clock.millis()));
    }

}
