package com.sommerph.zkinbox.repository.nullifier;

import com.sommerph.zkinbox.model.nullifier.NullifierKey;
import com.sommerph.zkinbox.model.nullifier.NullifierRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryNullifierRegistry implements NullifierRegistry {

    private final Map<NullifierKey, NullifierRecord> nullifierStore = new ConcurrentHashMap<>();

    @Override
    public boolean registerIfAbsent(NullifierRecord record) {
        boolean registered = nullifierStore.putIfAbsent(NullifierKey.of(record), record) == null;
        log.info("Register nullifier for epoch {}: {}", record.getEpoch(), registered ? "accepted" : "duplicate");
        return registered;
    }

    @Override
    public boolean exists(long epoch, String nullifier) {
        return nullifierStore.containsKey(new NullifierKey(epoch, nullifier));
    }

    @Override
    public void release(long epoch, String nullifier) {
        log.info("Release nullifier for epoch {}", epoch);
        nullifierStore.remove(new NullifierKey(epoch, nullifier));
    }

    @Override
    public int purgeBefore(long epoch) {
        int before = nullifierStore.size();
        nullifierStore.keySet().removeIf(key -> key.getEpoch() < epoch);
        return before - nullifierStore.size();
    }

}
