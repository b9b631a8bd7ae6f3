package com.sommerph.zkinbox.service.proof;

import com.sommerph.zkinbox.config.InboxProperties;
import com.sommerph.zkinbox.exception.ProofGenerationException;
import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.merkle.MerkleProof;
import com.sommerph.zkinbox.model.proof.ProofEnvelope;
import com.sommerph.zkinbox.service.hash.FieldHasher;
import com.sommerph.zkinbox.util.HashUtils;
import com.sommerph.zkinbox.util.HexUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural stand-in for a Groth16 prover. Proof elements are derived by hashing the
 * Merkle path and the public signals, and verification re-checks that {@code pi_c}
 * commits to {@code pi_a}, {@code pi_b} and the signals. It offers no zero-knowledge or
 * soundness guarantee; it only exercises the envelope contract end to end.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HashRelationProofSystem implements ProofSystem {

    private static final Pattern CANONICAL_DECIMAL = Pattern.compile("^(0|[1-9][0-9]*)$");

    private static final FieldElement TAG_A = domainTag("pi_a");
    private static final FieldElement TAG_B = domainTag("pi_b");
    private static final FieldElement TAG_C = domainTag("pi_c");

    private final FieldHasher hasher;
    private final InboxProperties properties;

    @Override
    public ProofEnvelope generate(MerkleProof merkleProof, long epoch, FieldElement nullifier, FieldElement signalHash) {
        log.info("Generate proof envelope for epoch {}", epoch);
        if (merkleProof == null || merkleProof.getRoot() == null
                || merkleProof.getPathElements() == null || merkleProof.getPathIndices() == null
                || merkleProof.getPathElements().size() != merkleProof.getPathIndices().size()) {
            throw new ProofGenerationException("Merkle proof is incomplete");
        }
        if (epoch < 0) {
            throw new ProofGenerationException("Epoch must be non-negative");
        }
        if (nullifier == null || signalHash == null) {
            throw new ProofGenerationException("Nullifier and signal hash are required");
        }

        FieldElement root = merkleProof.getRoot();
        FieldElement epochElement = FieldElement.of(epoch);

        List<FieldElement> witness = new ArrayList<>(merkleProof.getPathElements());
        merkleProof.getPathIndices().forEach(index -> witness.add(FieldElement.of(index)));
        FieldElement witnessDigest = hasher.hash(witness);

        FieldElement a1 = hasher.hash(TAG_A, witnessDigest, root);
        FieldElement a2 = hasher.hash(a1, nullifier);
        FieldElement[][] b = new FieldElement[2][2];
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                b[i][j] = hasher.hash(TAG_B, FieldElement.of(2L * i + j), a1, a2, epochElement);
            }
        }
        List<FieldElement> signals = List.of(root, epochElement, nullifier, signalHash);
        FieldElement[] c = relation(a1, a2, b, signals);

        return ProofEnvelope.builder()
                .pi_a(List.of(a1.toHex(), a2.toHex()))
                .pi_b(List.of(
                        List.of(b[0][0].toHex(), b[0][1].toHex()),
                        List.of(b[1][0].toHex(), b[1][1].toHex())))
                .pi_c(List.of(c[0].toHex(), c[1].toHex()))
                .protocol(properties.getProof().getProtocol())
                .curve(properties.getProof().getCurve())
                .publicSignals(signals.stream().map(FieldElement::toString).toList())
                .build();
    }

    @Override
    public boolean verify(ProofEnvelope envelope) {
        try {
            if (!hasExpectedShape(envelope)) {
                log.debug("Proof rejected: unexpected shape or tags");
                return false;
            }
            FieldElement[] a = new FieldElement[2];
            FieldElement[][] b = new FieldElement[2][2];
            FieldElement[] c = new FieldElement[2];
            for (int i = 0; i < 2; i++) {
                a[i] = scalar(envelope.getPi_a().get(i));
                c[i] = scalar(envelope.getPi_c().get(i));
                for (int j = 0; j < 2; j++) {
                    b[i][j] = scalar(envelope.getPi_b().get(i).get(j));
                }
            }
            if (containsNull(a) || containsNull(c) || containsNull(b[0]) || containsNull(b[1])) {
                log.debug("Proof rejected: malformed proof element");
                return false;
            }
            List<FieldElement> signals = publicSignals(envelope.getPublicSignals());
            if (signals == null) {
                log.debug("Proof rejected: public signals out of range");
                return false;
            }
            FieldElement[] expected = relation(a[0], a[1], b, signals);
            return expected[0].equals(c[0]) && expected[1].equals(c[1]);
        } catch (RuntimeException e) {
            log.debug("Proof rejected: {}", e.getMessage());
            return false;
        }
    }

    private FieldElement[] relation(FieldElement a1, FieldElement a2, FieldElement[][] b, List<FieldElement> signals) {
        List<FieldElement> inputs = new ArrayList<>(11);
        inputs.add(TAG_C);
        inputs.add(a1);
        inputs.add(a2);
        inputs.add(b[0][0]);
        inputs.add(b[0][1]);
        inputs.add(b[1][0]);
        inputs.add(b[1][1]);
        inputs.addAll(signals);
        FieldElement c1 = hasher.hash(inputs);
        FieldElement c2 = hasher.hash(c1, signals.get(ProofEnvelope.SIGNAL_HASH));
        return new FieldElement[]{c1, c2};
    }

    private boolean hasExpectedShape(ProofEnvelope envelope) {
        return envelope != null
                && envelope.getPi_a() != null && envelope.getPi_a().size() == 2
                && envelope.getPi_c() != null && envelope.getPi_c().size() == 2
                && envelope.getPi_b() != null && envelope.getPi_b().size() == 2
                && envelope.getPi_b().stream().allMatch(row -> row != null && row.size() == 2)
                && envelope.getPublicSignals() != null
                && envelope.getPublicSignals().size() == ProofEnvelope.PUBLIC_SIGNAL_COUNT
                && properties.getProof().getProtocol().equals(envelope.getProtocol())
                && properties.getProof().getCurve().equals(envelope.getCurve());
    }

    // Fixed-length hex below the field modulus, or null.
    private static FieldElement scalar(String hex) {
        if (!HexUtils.isFixedHexScalar(hex)) {
            return null;
        }
        BigInteger value = HexUtils.parseFixedHex(hex);
        return value.compareTo(FieldElement.MODULUS) < 0 ? FieldElement.of(value) : null;
    }

    // Root and nullifier non-empty, epoch a non-negative integer, all canonical ASCII decimals below the modulus.
    private static List<FieldElement> publicSignals(List<String> raw) {
        List<FieldElement> signals = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String value = raw.get(i);
            if (value == null || !CANONICAL_DECIMAL.matcher(value).matches()) {
                return null;
            }
            BigInteger parsed = new BigInteger(value);
            if (parsed.compareTo(FieldElement.MODULUS) >= 0) {
                return null;
            }
            if (i == ProofEnvelope.EPOCH && parsed.bitLength() > 62) {
                return null;
            }
            signals.add(FieldElement.of(parsed));
        }
        return signals;
    }

    private static boolean containsNull(FieldElement[] values) {
        for (FieldElement value : values) {
            if (value == null) {
                return true;
            }
        }
        return false;
    }

    private static FieldElement domainTag(String label) {
        return FieldElement.of(new BigInteger(1, HashUtils.sha256("zk-inbox/proof/" + label)));
    }

}
