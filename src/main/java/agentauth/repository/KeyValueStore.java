package agentauth.repository;

import agentauth.model.Expirable;

import java.util.Date;
import java.util.Optional;

/**
 * Storage for clients, authorization codes, refresh tokens and revoked access tokens. Implementations must
 * be safe for concurrent use and {@link #getAndDelete(String)} must be atomic: for concurrent calls with
 * the same key at most one caller receives the value.
 */
public interface KeyValueStore<T extends Expirable> {

    Class<T> getEntityType();

    void put(T value);

    Optional<T> find(String key);

    Optional<T> getAndDelete(String key);

    boolean delete(String key);

    long deleteByExpiresInBefore(Date date);

    void deleteAll();

    long count();
}
