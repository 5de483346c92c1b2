package tech.yump.passkeeper.secrets;

import tech.yump.passkeeper.core.NotFoundException;

/**
 * No secret matches the (owner, id) pair. The message never reveals whether the id exists for someone else.
 */
public class SecretNotFoundException extends NotFoundException {

    public SecretNotFoundException(String kind) {
        super(kind + " not found");
    }
}
