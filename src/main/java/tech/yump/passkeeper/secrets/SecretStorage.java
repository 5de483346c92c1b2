package tech.yump.passkeeper.secrets;

import java.util.Optional;

/**
 * Owner-scoped persistence for one secret kind. Every method filters by owner id, so a record
 * belonging to another owner behaves exactly like a missing one.
 *
 * @param <R> stored record, sensitive fields already encrypted
 * @param <T> search result item, display fields only
 */
public interface SecretStorage<R, T> {

    /**
     * @return the generated id
     * @throws tech.yump.passkeeper.core.BackendException on persistence failure
     */
    String add(String ownerId, R record);

    Optional<R> find(String ownerId, String id);

    SearchPage<T> search(String ownerId, SearchQuery query);

    /**
     * @return {@code false} if no record matched the owner and id
     */
    boolean remove(String ownerId, String id);
}
