package tech.yump.passkeeper.sync;

import java.time.Instant;

/**
 * Per-owner last-mutation marker used by clients to detect a stale cache.
 */
public interface SyncTracker {

    /**
     * @throws SyncMarkerNotFoundException if the owner has never mutated anything
     */
    Instant get(String ownerId);

    /**
     * Records "now" as the owner's last mutation time. The stored value never moves backwards.
     */
    void set(String ownerId);
}
