package tech.yump.passkeeper.user;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import tech.yump.passkeeper.core.BackendException;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcUserStorage implements UserStorage {

    private static final String INSERT_SQL = "INSERT INTO usr_users (login, pass_hash) VALUES (?, ?) RETURNING id";
    private static final String FIND_BY_LOGIN_SQL = "SELECT id, login, pass_hash FROM usr_users WHERE login = ?";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public String saveUser(String login, String passwordHash) {
        try {
            UUID id = jdbcTemplate.queryForObject(INSERT_SQL, UUID.class, login, passwordHash);
            log.debug("Inserted user '{}' with id {}", login, id);
            return String.valueOf(id);
        } catch (DuplicateKeyException e) {
            log.debug("Login '{}' is already taken", login);
            throw new UserAlreadyExistsException(login);
        } catch (DataAccessException e) {
            log.error("Failed to insert user '{}': {}", login, e.getMessage(), e);
            throw new BackendException("Failed to store user", e);
        }
    }

    @Override
    public Optional<UserCredentials> findByLogin(String login) {
        try {
            return jdbcTemplate.query(FIND_BY_LOGIN_SQL,
                            (rs, rowNum) -> new UserCredentials(rs.getString("id"), rs.getString("login"), rs.getString("pass_hash")),
                            login)
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            log.error("Failed to read user '{}': {}", login, e.getMessage(), e);
            throw new BackendException("Failed to read user", e);
        }
    }
}
