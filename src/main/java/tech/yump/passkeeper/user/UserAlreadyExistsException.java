package tech.yump.passkeeper.user;

public class UserAlreadyExistsException extends RuntimeException {

    public UserAlreadyExistsException(String login) {
        super("user with login " + login + " already exists");
    }
}
