package tech.yump.passkeeper.secrets.account;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import tech.yump.passkeeper.storage.AbstractJdbcSecretStorage;

import java.util.List;

@Repository
public class JdbcAccountStorage extends AbstractJdbcSecretStorage<StoredAccount, AccountItem> implements AccountStorage {

    public JdbcAccountStorage(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate,
                "sec_accounts",
                List.of("login", "server", "password", "meta"),
                List.of("login", "server", "password", "meta"),
                List.of("login", "server"),
                List.of("server", "login"),
                List.of("server", "login"));
    }

    @Override
    protected Object[] insertValues(StoredAccount record) {
        return new Object[]{record.login(), record.server(), record.password(), record.meta()};
    }

    @Override
    protected RowMapper<StoredAccount> recordMapper() {
        return (rs, rowNum) -> new StoredAccount(
                rs.getString("id"),
                rs.getString("login"),
                rs.getString("server"),
                rs.getString("password"),
                rs.getString("meta"));
    }

    @Override
    protected RowMapper<AccountItem> itemMapper() {
        return (rs, rowNum) -> new AccountItem(
                rs.getString("id"),
                rs.getString("login"),
                rs.getString("server"));
    }
}
