package tech.yump.passkeeper.core;

/**
 * No data exists for the requested owner-scoped key. Records owned by another principal
 * are reported the same way as missing ones.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
