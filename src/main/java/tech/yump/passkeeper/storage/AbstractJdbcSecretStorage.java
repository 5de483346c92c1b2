package tech.yump.passkeeper.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import tech.yump.passkeeper.core.BackendException;
import tech.yump.passkeeper.secrets.SearchPage;
import tech.yump.passkeeper.secrets.SearchQuery;
import tech.yump.passkeeper.secrets.SecretStorage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of the owner-scoped secret storage contract.
 * Every statement filters on the {@code uid} column. Table and column names come from subclasses, never from input.
 *
 * @param <R> stored record
 * @param <T> search result item
 */
@Slf4j
public abstract class AbstractJdbcSecretStorage<R, T> implements SecretStorage<R, T> {

    protected final JdbcTemplate jdbcTemplate;

    private final String table;
    private final String insertSql;
    private final String findSql;
    private final String searchSql;
    private final String countSql;
    private final String deleteSql;
    private final int searchColumnCount;

    /**
     * @param table          table name
     * @param insertColumns  columns written on insert, after {@code uid}
     * @param recordColumns  columns read by {@link #find(String, String)}
     * @param itemColumns    columns read by {@link #search(String, SearchQuery)}
     * @param searchColumns  display columns matched against the search substring
     * @param orderColumns   display columns giving the deterministic result order
     */
    protected AbstractJdbcSecretStorage(JdbcTemplate jdbcTemplate,
                                        String table,
                                        List<String> insertColumns,
                                        List<String> recordColumns,
                                        List<String> itemColumns,
                                        List<String> searchColumns,
                                        List<String> orderColumns) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
        this.searchColumnCount = searchColumns.size();

        String placeholders = insertColumns.stream().map(c -> "?").collect(Collectors.joining(", "));
        String matchClause = searchColumns.stream()
                .map(column -> column + " ILIKE ?")
                .collect(Collectors.joining(" OR ", "(", ")"));

        this.insertSql = "INSERT INTO " + table + " (uid, " + String.join(", ", insertColumns) + ") "
                + "VALUES (?, " + placeholders + ") RETURNING id";
        this.findSql = "SELECT id, " + String.join(", ", recordColumns) + " FROM " + table
                + " WHERE uid = ? AND id = ?";
        this.searchSql = "SELECT id, " + String.join(", ", itemColumns) + " FROM " + table
                + " WHERE uid = ? AND " + matchClause
                + " ORDER BY " + String.join(", ", orderColumns) + ", id OFFSET ? LIMIT ?";
        this.countSql = "SELECT count(*) FROM " + table + " WHERE uid = ? AND " + matchClause;
        this.deleteSql = "DELETE FROM " + table + " WHERE uid = ? AND id = ?";
    }

    /**
     * Values for the insert columns, in constructor order.
     */
    protected abstract Object[] insertValues(R record);

    protected abstract RowMapper<R> recordMapper();

    protected abstract RowMapper<T> itemMapper();

    @Override
    public String add(String ownerId, R record) {
        UUID uid = requireOwner(ownerId);
        Object[] values = insertValues(record);
        Object[] args = new Object[values.length + 1];
        args[0] = uid;
        System.arraycopy(values, 0, args, 1, values.length);
        try {
            UUID id = jdbcTemplate.queryForObject(insertSql, UUID.class, args);
            log.debug("Inserted row {} into {} for owner '{}'", id, table, ownerId);
            return String.valueOf(id);
        } catch (DataAccessException e) {
            log.error("Failed to insert into {} for owner '{}': {}", table, ownerId, e.getMessage(), e);
            throw new BackendException("Failed to store record in " + table, e);
        }
    }

    @Override
    public Optional<R> find(String ownerId, String id) {
        Optional<UUID> uid = JdbcSupport.parseUuid(ownerId);
        Optional<UUID> recordId = JdbcSupport.parseUuid(id);
        if (uid.isEmpty() || recordId.isEmpty()) {
            return Optional.empty();
        }
        try {
            return jdbcTemplate.query(findSql, recordMapper(), uid.get(), recordId.get())
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            log.error("Failed to read {} row {} for owner '{}': {}", table, id, ownerId, e.getMessage(), e);
            throw new BackendException("Failed to read record from " + table, e);
        }
    }

    @Override
    public SearchPage<T> search(String ownerId, SearchQuery query) {
        Optional<UUID> uid = JdbcSupport.parseUuid(ownerId);
        if (uid.isEmpty()) {
            return new SearchPage<>(List.of(), 0);
        }
        List<Object> matchArgs = new ArrayList<>();
        matchArgs.add(uid.get());
        String pattern = JdbcSupport.containsPattern(query.substring());
        for (int i = 0; i < searchColumnCount; i++) {
            matchArgs.add(pattern);
        }
        List<Object> pageArgs = new ArrayList<>(matchArgs);
        pageArgs.add(query.offset());
        pageArgs.add(query.limit());

        try {
            List<T> items = jdbcTemplate.query(searchSql, itemMapper(), pageArgs.toArray());
            Long count = jdbcTemplate.queryForObject(countSql, Long.class, matchArgs.toArray());
            return new SearchPage<>(items, count == null ? 0 : count);
        } catch (DataAccessException e) {
            log.error("Failed to search {} for owner '{}': {}", table, ownerId, e.getMessage(), e);
            throw new BackendException("Failed to search records in " + table, e);
        }
    }

    @Override
    public boolean remove(String ownerId, String id) {
        Optional<UUID> uid = JdbcSupport.parseUuid(ownerId);
        Optional<UUID> recordId = JdbcSupport.parseUuid(id);
        if (uid.isEmpty() || recordId.isEmpty()) {
            return false;
        }
        try {
            int deleted = jdbcTemplate.update(deleteSql, uid.get(), recordId.get());
            log.debug("Deleted {} row(s) from {} for owner '{}', id {}", deleted, table, ownerId, id);
            return deleted > 0;
        } catch (DataAccessException e) {
            log.error("Failed to delete {} row {} for owner '{}': {}", table, id, ownerId, e.getMessage(), e);
            throw new BackendException("Failed to delete record from " + table, e);
        }
    }

    protected UUID requireOwner(String ownerId) {
        return JdbcSupport.parseUuid(ownerId)
                .orElseThrow(() -> new BackendException("Invalid owner id: " + ownerId));
    }
}
