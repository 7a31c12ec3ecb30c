package agentauth.model;

import java.time.Clock;
import java.util.Date;

/**
 * Record kept in a {@link agentauth.repository.KeyValueStore}. A {@code null} expiry never expires.
 */
public interface Expirable {

    String getId();

    Date getExpiresIn();

    default boolean isExpired(Clock clock) {
        Date expiresIn = getExpiresIn();
        return expiresIn != null && clock.instant().isAfter(expiresIn.toInstant());
    }
}
