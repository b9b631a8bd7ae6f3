package com.sommerph.zkinbox.model.proof;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Groth16-shaped proof as exchanged with clients. {@code publicSignals} is always
 * {@code [root, epoch, nullifier, signalHash]} as decimal strings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProofEnvelope {

    public static final int ROOT = 0;
    public static final int EPOCH = 1;
    public static final int NULLIFIER = 2;
    public static final int SIGNAL_HASH = 3;
    public static final int PUBLIC_SIGNAL_COUNT = 4;

    private List<String> pi_a;        // [2] hex scalars
    private List<List<String>> pi_b;  // [2][2] hex scalars
    private List<String> pi_c;        // [2] hex scalars
    private String protocol;
    private String curve;
    private List<String> publicSignals;

    public String rootSignal() {
        return publicSignals.get(ROOT);
    }

    public String epochSignal() {
        return publicSignals.get(EPOCH);
    }

    public String nullifierSignal() {
        return publicSignals.get(NULLIFIER);
    }

    public String signalHashSignal() {
        return publicSignals.get(SIGNAL_HASH);
    }

}
