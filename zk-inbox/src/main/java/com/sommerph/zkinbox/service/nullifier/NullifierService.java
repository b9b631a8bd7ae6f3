package com.sommerph.zkinbox.service.nullifier;

import com.sommerph.zkinbox.config.InboxProperties;
import com.sommerph.zkinbox.exception.DuplicateNullifierException;
import com.sommerph.zkinbox.model.field.FieldElement;
import com.sommerph.zkinbox.model.nullifier.NullifierRecord;
import com.sommerph.zkinbox.repository.nullifier.NullifierRegistry;
import com.sommerph.zkinbox.service.hash.FieldHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class NullifierService {

    private final FieldHasher hasher;
    private final NullifierRegistry nullifierRegistry;
    private final InboxProperties properties;
    private final Clock clock;

    public static long currentEpoch(Instant now, long epochDurationSeconds) {
        if (epochDurationSeconds <= 0) {
            throw new IllegalArgumentException("Epoch duration must be positive");
        }
        return Math.floorDiv(now.getEpochSecond(), epochDurationSeconds);
    }

    public long currentEpoch() {
        return currentEpoch(clock.instant(), epochDurationSeconds());
    }

    public Instant epochStart(long epoch) {
        return Instant.ofEpochSecond(Math.multiplyExact(epoch, epochDurationSeconds()));
    }

    public long epochDurationSeconds() {
        return properties.getEpoch().getDurationSeconds();
    }

    public FieldElement deriveNullifier(FieldElement secret, long epoch) {
        return hasher.hash(secret, FieldElement.of(epoch));
    }

    /**
     * Atomically claims the (epoch, nullifier) pair.
     *
     * @throws DuplicateNullifierException if the pair was already claimed
     */
    public NullifierRecord registerIfUnused(FieldElement nullifier, long epoch) {
        NullifierRecord record = new NullifierRecord(epoch, nullifier.toString(), clock.instant().getEpochSecond());
        if (!nullifierRegistry.registerIfAbsent(record)) {
            throw new DuplicateNullifierException("Nullifier already used in epoch " + epoch);
        }
        return record;
    }

    public boolean isUsed(FieldElement nullifier, long epoch) {
        return nullifierRegistry.exists(epoch, nullifier.toString());
    }

    /** Undoes a registration whose submission could not be committed. */
    public void release(FieldElement nullifier, long epoch) {
        log.info("Roll back nullifier registration for epoch {}", epoch);
        nullifierRegistry.release(epoch, nullifier.toString());
    }

    @Scheduled(fixedDelayString = "${inbox.epoch.purge-interval-ms:3600000}")
    public int purgeExpired() {
        long horizon = currentEpoch() - properties.getEpoch().getRetentionEpochs();
        int removed = nullifierRegistry.purgeBefore(horizon);
        if (removed > 0) {
            log.info("Purged {} nullifiers older than epoch {}", removed, horizon);
        }
        return removed;
    }

}
