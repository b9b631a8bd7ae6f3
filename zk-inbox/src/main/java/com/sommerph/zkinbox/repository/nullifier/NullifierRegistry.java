package com.sommerph.zkinbox.repository.nullifier;

import com.sommerph.zkinbox.model.nullifier.NullifierRecord;

/**
 * Store of used (epoch, nullifier) pairs. Implementations must make
 * {@link #registerIfAbsent} a single atomic compare-and-set per key.
 */
public interface NullifierRegistry {

    /**
     * @return true if the pair was unused and is now registered, false if it was already taken
     */
    boolean registerIfAbsent(NullifierRecord record);

    boolean exists(long epoch, String nullifier);

    void release(long epoch, String nullifier);

    /**
     * Drops every entry whose epoch is strictly lower than {@code epoch}.
     *
     * @return number of removed entries
     */
    int purgeBefore(long epoch);

}
