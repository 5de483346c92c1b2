package tech.yump.passkeeper.storage;

import java.util.Optional;
import java.util.UUID;

/**
 * Helpers shared by the JDBC storage implementations.
 */
public final class JdbcSupport {

    private static final char LIKE_ESCAPE = '\\';

    private JdbcSupport() {
    }

    /**
     * Parses an id into a UUID. Malformed ids cannot match any row, so they map to empty.
     */
    public static Optional<UUID> parseUuid(String id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(id.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Builds a {@code %substring%} pattern for ILIKE with {@code %}, {@code _} and the escape character escaped.
     */
    public static String containsPattern(String substring) {
        StringBuilder pattern = new StringBuilder("%");
        for (char c : (substring == null ? "" : substring).toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                pattern.append(LIKE_ESCAPE);
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }
}
