package tech.yump.passkeeper.secrets.note;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import tech.yump.passkeeper.storage.AbstractJdbcSecretStorage;

import java.util.List;

@Repository
public class JdbcNoteStorage extends AbstractJdbcSecretStorage<StoredNote, NoteItem> implements NoteStorage {

    public JdbcNoteStorage(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate,
                "sec_notes",
                List.of("name", "content", "meta"),
                List.of("name", "content", "meta"),
                List.of("name"),
                List.of("name"),
                List.of("name"));
    }

    @Override
    protected Object[] insertValues(StoredNote record) {
        return new Object[]{record.name(), record.content(), record.meta()};
    }

    @Override
    protected RowMapper<StoredNote> recordMapper() {
        return (rs, rowNum) -> new StoredNote(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("content"),
                rs.getString("meta"));
    }

    @Override
    protected RowMapper<NoteItem> itemMapper() {
        return (rs, rowNum) -> new NoteItem(rs.getString("id"), rs.getString("name"));
    }
}
