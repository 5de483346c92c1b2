package tech.yump.passkeeper.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import tech.yump.passkeeper.core.BackendException;
import tech.yump.passkeeper.storage.JdbcSupport;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcSyncStorage implements SyncStorage {

    private static final String SELECT_SQL = "SELECT timestamp FROM syn_timestamps WHERE uid = ?";

    // GREATEST keeps the marker monotonic when two writers race
    private static final String UPSERT_SQL =
            "INSERT INTO syn_timestamps (uid, timestamp) VALUES (?, ?) " +
            "ON CONFLICT ON CONSTRAINT syn_timestamps_pk " +
            "DO UPDATE SET timestamp = GREATEST(syn_timestamps.timestamp, excluded.timestamp)";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<Instant> find(String ownerId) {
        Optional<UUID> uid = JdbcSupport.parseUuid(ownerId);
        if (uid.isEmpty()) {
            return Optional.empty();
        }
        try {
            List<Instant> rows = jdbcTemplate.query(SELECT_SQL,
                    (rs, rowNum) -> rs.getObject("timestamp", OffsetDateTime.class).toInstant(),
                    uid.get());
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Failed to read sync marker for owner '{}': {}", ownerId, e.getMessage(), e);
            throw new BackendException("Failed to read sync marker for owner: " + ownerId, e);
        }
    }

    @Override
    public void upsert(String ownerId, Instant timestamp) {
        UUID uid = JdbcSupport.parseUuid(ownerId)
                .orElseThrow(() -> new BackendException("Invalid owner id for sync marker: " + ownerId));
        try {
            jdbcTemplate.update(UPSERT_SQL, uid, OffsetDateTime.ofInstant(timestamp, ZoneOffset.UTC));
        } catch (DataAccessException e) {
            log.error("Failed to upsert sync marker for owner '{}': {}", ownerId, e.getMessage(), e);
            throw new BackendException("Failed to update sync marker for owner: " + ownerId, e);
        }
    }
}
