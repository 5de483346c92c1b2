package tech.yump.passkeeper.sync;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence of sync markers, one per owner.
 */
public interface SyncStorage {

    Optional<Instant> find(String ownerId);

    /**
     * Inserts the marker or replaces it when the new timestamp is later than the stored one.
     */
    void upsert(String ownerId, Instant timestamp);
}
