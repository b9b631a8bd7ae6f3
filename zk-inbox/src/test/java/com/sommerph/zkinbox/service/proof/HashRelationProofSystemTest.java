package com.sommerph.zkinbox.service.proof;

import com.sommerph.zkinbox.InboxFixture;
import com.sommerph.zkinbox.exception.ProofGenerationException;
import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.identity.Identity;
import com.sommerph.zkinbox.model.merkle.MerkleProof;
import com.sommerph.zkinbox.model.proof.ProofEnvelope;
import com.sommerph.zkinbox.util.HexUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.sommerph.zkinbox.InboxFixture.EPOCH;
import static org.junit.jupiter.api.Assertions.*;

class HashRelationProofSystemTest {

    private InboxFixture fixture;
    private HashRelationProofSystem proofSystem;
    private MerkleProof merkleProof;
    private FieldElement nullifier;
    private FieldElement signalHash;

    @BeforeEach
    void setup() {
        fixture = new InboxFixture().withMembers(5);
        proofSystem = fixture.proofSystem;
        Identity identity = fixture.member(2);
        merkleProof = fixture.group.proveMembership(identity.getCommitment());
        nullifier = fixture.nullifierService.deriveNullifier(identity.getSecret(), EPOCH);
        signalHash = fixture.pipeline.signalHash("hello".getBytes());
    }

    @Test
    void generatedEnvelopeHasGroth16Shape() {
        ProofEnvelope proof = proofSystem.generate(merkleProof, EPOCH, nullifier, signalHash);

        assertEquals("groth16", proof.getProtocol());
        assertEquals("bn254", proof.getCurve());
        assertEquals(2, proof.getPi_a().size());
        assertEquals(2, proof.getPi_b().size());
        assertEquals(2, proof.getPi_b().get(0).size());
        assertEquals(2, proof.getPi_c().size());
        proof.getPi_a().forEach(hex -> assertTrue(HexUtils.isFixedHexScalar(hex), hex));

        assertEquals(List.of(merkleProof.getRoot().toString(), String.valueOf(EPOCH),
                nullifier.toString(), signalHash.toString()), proof.getPublicSignals());
        assertTrue(proofSystem.verify(proof));
    }

    @Test
    void tamperedSignalsFailVerification() {
        ProofEnvelope proof = proofSystem.generate(merkleProof, EPOCH, nullifier, signalHash);
        List<String> signals = new ArrayList<>(proof.getPublicSignals());
        signals.set(ProofEnvelope.NULLIFIER, nullifier.add(FieldElement.ONE).toString());
        proof.setPublicSignals(signals);
        assertFalse(proofSystem.verify(proof));
    }

    @Test
    void tamperedProofElementFailsVerification() {
        ProofEnvelope proof = proofSystem.generate(merkleProof, EPOCH, nullifier, signalHash);
        proof.setPi_a(List.of(proof.getPi_a().get(0), FieldElement.of(7).toHex()));
        assertFalse(proofSystem.verify(proof));
    }

    @Test
    void malformedEnvelopesAreRejectedWithoutThrowing() {
        ProofEnvelope good = proofSystem.generate(merkleProof, EPOCH, nullifier, signalHash);

        assertFalse(proofSystem.verify(null));
        assertFalse(proofSystem.verify(copy(good).protocol("plonk").build()));
        assertFalse(proofSystem.verify(copy(good).curve("bls12-381").build()));
        assertFalse(proofSystem.verify(copy(good).publicSignals(good.getPublicSignals().subList(0, 3)).build()));
        assertFalse(proofSystem.verify(copy(good).pi_a(List.of("0x12", good.getPi_a().get(1))).build()));
        assertFalse(proofSystem.verify(copy(good).pi_c(List.of(HexUtils.toFixedHex(FieldElement.MODULUS),
                good.getPi_c().get(1))).build()));

        List<String> signals = new ArrayList<>(good.getPublicSignals());
        signals.set(ProofEnvelope.EPOCH, "-1");
        assertFalse(proofSystem.verify(copy(good).publicSignals(signals).build()));
        signals.set(ProofEnvelope.EPOCH, "");
        assertFalse(proofSystem.verify(copy(good).publicSignals(signals).build()));
    }

    @Test
    void nonCanonicalSignalSpellingsAreRejected() {
        ProofEnvelope good = proofSystem.generate(merkleProof, EPOCH, nullifier, signalHash);

        List<String> arabicEpoch = new ArrayList<>(good.getPublicSignals());
        arabicEpoch.set(ProofEnvelope.EPOCH, "\u0661\u0669\u0668\u0667\u0666");
        assertFalse(proofSystem.verify(copy(good).publicSignals(arabicEpoch).build()));

        List<String> paddedNullifier = new ArrayList<>(good.getPublicSignals());
        paddedNullifier.set(ProofEnvelope.NULLIFIER, "000" + nullifier);
        assertFalse(proofSystem.verify(copy(good).publicSignals(paddedNullifier).build()));

        List<String> signedRoot = new ArrayList<>(good.getPublicSignals());
        signedRoot.set(ProofEnvelope.ROOT, "+" + merkleProof.getRoot());
        assertFalse(proofSystem.verify(copy(good).publicSignals(signedRoot).build()));
    }

    @Test
    void incompleteInputsCannotBeProven() {
        assertThrows(ProofGenerationException.class, () -> proofSystem.generate(null, EPOCH, nullifier, signalHash));
        assertThrows(ProofGenerationException.class, () -> proofSystem.generate(merkleProof, -1, nullifier, signalHash));
        assertThrows(ProofGenerationException.class, () -> proofSystem.generate(merkleProof, EPOCH, null, signalHash));
        MerkleProof uneven = new MerkleProof(merkleProof.getRoot(), merkleProof.getPathElements(), List.of(0));
        assertThrows(ProofGenerationException.class, () -> proofSystem.generate(uneven, EPOCH, nullifier, signalHash));
    }

    private static ProofEnvelope.ProofEnvelopeBuilder copy(ProofEnvelope envelope) {
        return ProofEnvelope.builder()
                .pi_a(envelope.getPi_a())
                .pi_b(envelope.getPi_b())
                .pi_c(envelope.getPi_c())
                .protocol(envelope.getProtocol())
                .curve(envelope.getCurve())
                .publicSignals(envelope.getPublicSignals());
    }

}
