package tech.yump.passkeeper.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class SyncTrackerImpl implements SyncTracker {

    private final SyncStorage syncStorage;
    private final Clock clock;

    @Override
    public Instant get(String ownerId) {
        Instant timestamp = syncStorage.find(ownerId)
                .orElseThrow(SyncMarkerNotFoundException::new);
        log.debug("Sync marker for owner '{}' is {}", ownerId, timestamp);
        return timestamp;
    }

    @Override
    public void set(String ownerId) {
        Instant now = clock.instant();
        syncStorage.upsert(ownerId, now);
        log.debug("Sync marker for owner '{}' set to {}", ownerId, now);
    }
}
