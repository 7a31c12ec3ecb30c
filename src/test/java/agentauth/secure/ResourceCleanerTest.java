package agentauth.secure;

import agentauth.model.AuthorizationCode;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import agentauth.model.RefreshToken;
import agentauth.model.RevokedAccessToken;
import agentauth.repository.InMemoryKeyValueStore;
import agentauth.repository.KeyValueStore;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ResourceCleanerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private final KeyValueStore<AuthorizationCode> authorizationCodeStore = new InMemoryKeyValueStore<>(AuthorizationCode.class);
    private final KeyValueStore<RefreshToken> refreshTokenStore = new InMemoryKeyValueStore<>(RefreshToken.class);
    private final KeyValueStore<RevokedAccessToken> revokedAccessTokenStore = new InMemoryKeyValueStore<>(RevokedAccessToken.class);

    @Test
    public void clean() {
        seed();
        ResourceCleaner subject = resourceCleaner(true);

        subject.cleanAuthorizationCodes();
        subject.cleanRefreshTokens();
        subject.cleanRevokedAccessTokens();

        assertEquals(1L, authorizationCodeStore.count());
        assertTrue(authorizationCodeStore.find("valid").isPresent());
        assertEquals(1L, refreshTokenStore.count());
        assertTrue(refreshTokenStore.find("valid").isPresent());
        assertEquals(1L, revokedAccessTokenStore.count());
        assertTrue(revokedAccessTokenStore.find("valid").isPresent());
    }

    @Test
    public void cleanLogsEvictions() {
        seed();
        Logger logger = (Logger) LoggerFactory.getLogger(ResourceCleaner.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            resourceCleaner(true).cleanRefreshTokens();
        } finally {
            logger.detachAppender(appender);
        }
        assertTrue(appender.list.stream()
                .anyMatch(event -> event.getFormattedMessage().equals("Deleted 1 instances of RefreshToken")));
    }

    @Test
    public void notResponsible() {
        seed();
        ResourceCleaner subject = resourceCleaner(false);

        subject.cleanAuthorizationCodes();
        subject.cleanRefreshTokens();
        subject.cleanRevokedAccessTokens();

        assertEquals(2L, authorizationCodeStore.count());
        assertEquals(2L, refreshTokenStore.count());
        assertEquals(2L, revokedAccessTokenStore.count());
    }

    private void seed() {
        Date expired = Date.from(NOW.minusSeconds(1));
        Date valid = Date.from(NOW.plusSeconds(600));
        authorizationCodeStore.put(authorizationCode("expired", expired));
        authorizationCodeStore.put(authorizationCode("valid", valid));
        refreshTokenStore.put(new RefreshToken("expired", "client", "user", "workspace", expired));
        refreshTokenStore.put(new RefreshToken("valid", "client", "user", "workspace", valid));
        revokedAccessTokenStore.put(new RevokedAccessToken("expired", "client", expired));
        revokedAccessTokenStore.put(new RevokedAccessToken("valid", "client", valid));
    }

    private AuthorizationCode authorizationCode(String code, Date expiresIn) {
        return new AuthorizationCode(code, "client", "user", "workspace", "http://localhost/callback",
                null, null, expiresIn);
    }

    private ResourceCleaner resourceCleaner(boolean cronJobResponsible) {
        return new ResourceCleaner(authorizationCodeStore, refreshTokenStore, revokedAccessTokenStore,
                Clock.fixed(NOW, ZoneOffset.UTC), cronJobResponsible);
    }
}
