package agentauth.secure;

import agentauth.model.AuthorizationCode;
import agentauth.model.RefreshToken;
import agentauth.model.RevokedAccessToken;
import agentauth.repository.KeyValueStore;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Date;

/**
 * Evicts expired entries, one timer per store. Read paths check expiry themselves, so this only bounds
 * storage growth.
 */
@Component
public class ResourceCleaner {

    private static final Log LOG = LogFactory.getLog(ResourceCleaner.class);

    private final KeyValueStore<AuthorizationCode> authorizationCodeStore;
    private final KeyValueStore<RefreshToken> refreshTokenStore;
    private final KeyValueStore<RevokedAccessToken> revokedAccessTokenStore;
    private final Clock clock;
    private final boolean cronJobResponsible;

    @Autowired
    public ResourceCleaner(KeyValueStore<AuthorizationCode> authorizationCodeStore,
                           KeyValueStore<RefreshToken> refreshTokenStore,
                           KeyValueStore<RevokedAccessToken> revokedAccessTokenStore,
                           Clock clock,
                           @Value("${cron.node-cron-job-responsible}") boolean cronJobResponsible) {
        this.authorizationCodeStore = authorizationCodeStore;
        this.refreshTokenStore = refreshTokenStore;
        this.revokedAccessTokenStore = revokedAccessTokenStore;
        this.clock = clock;
        this.cronJobResponsible = cronJobResponsible;
    }

    @Scheduled(fixedDelayString = "${cron.sweep-interval-ms}", initialDelayString = "${cron.sweep-interval-ms}")
    public void cleanAuthorizationCodes() {
        clean(authorizationCodeStore);
    }

    @Scheduled(fixedDelayString = "${cron.sweep-interval-ms}", initialDelayString = "${cron.sweep-interval-ms}")
    public void cleanRefreshTokens() {
        clean(refreshTokenStore);
    }

    @Scheduled(fixedDelayString = "${cron.sweep-interval-ms}", initialDelayString = "${cron.sweep-interval-ms}")
    public void cleanRevokedAccessTokens() {
        clean(revokedAccessTokenStore);
    }

    private void clean(KeyValueStore<?> store) {
        if (!cronJobResponsible) {
            return;
        }
        long count = store.deleteByExpiresInBefore(Date.from(clock.instant()));
        LOG.info(String.format("Deleted %s instances of %s", count, store.getEntityType().getSimpleName()));
    }
}
