package tech.yump.passkeeper.user;

import java.util.Optional;

public interface UserStorage {

    /**
     * @return the generated user id
     * @throws UserAlreadyExistsException if the login is taken
     * @throws tech.yump.passkeeper.core.BackendException on persistence failure
     */
    String saveUser(String login, String passwordHash);

    Optional<UserCredentials> findByLogin(String login);
}
