package tech.yump.passkeeper.secrets.file;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import tech.yump.passkeeper.core.BackendException;
import tech.yump.passkeeper.storage.AbstractJdbcSecretStorage;
import tech.yump.passkeeper.storage.JdbcSupport;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Repository
public class JdbcFileStorage extends AbstractJdbcSecretStorage<StoredFile, FileItem> implements FileStorage {

    private static final String EXISTS_SQL = "SELECT EXISTS (SELECT 1 FROM sec_files WHERE uid = ? AND name = ?)";

    public JdbcFileStorage(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate,
                "sec_files",
                List.of("name", "meta"),
                List.of("name", "meta"),
                List.of("name"),
                List.of("name"),
                List.of("name"));
    }

    @Override
    public boolean existsByName(String ownerId, String name) {
        Optional<UUID> uid = JdbcSupport.parseUuid(ownerId);
        if (uid.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(jdbcTemplate.queryForObject(EXISTS_SQL, Boolean.class, uid.get(), name));
        } catch (DataAccessException e) {
            log.error("Failed to check file name '{}' for owner '{}': {}", name, ownerId, e.getMessage(), e);
            throw new BackendException("Failed to read record from sec_files", e);
        }
    }

    @Override
    protected Object[] insertValues(StoredFile record) {
        return new Object[]{record.name(), record.meta()};
    }

    @Override
    protected RowMapper<StoredFile> recordMapper() {
        return (rs, rowNum) -> new StoredFile(rs.getString("id"), rs.getString("name"), rs.getString("meta"));
    }

    @Override
    protected RowMapper<FileItem> itemMapper() {
        return (rs, rowNum) -> new FileItem(rs.getString("id"), rs.getString("name"));
    }
}
