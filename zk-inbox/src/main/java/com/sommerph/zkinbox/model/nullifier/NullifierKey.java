package com.sommerph.zkinbox.model.nullifier;

import lombok.Value;

/** Replay-detection key; a nullifier is only unique within its epoch. */
@Value
public class NullifierKey {

    long epoch;
    String nullifier;

    public static NullifierKey of(NullifierRecord record) {
        return new NullifierKey(record.getEpoch(), record.getNullifier());
    }

}
