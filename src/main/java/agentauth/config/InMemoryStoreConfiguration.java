package agentauth.config;

import agentauth.model.AuthorizationCode;
import agentauth.model.RefreshToken;
import agentauth.model.RegisteredClient;
import agentauth.model.RevokedAccessToken;
import agentauth.repository.InMemoryKeyValueStore;
import agentauth.repository.KeyValueStore;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process local stores. All state is lost on restart and is not shared between instances.
 */
@Configuration
@ConditionalOnProperty(name = "storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryStoreConfiguration {

    private static final Log LOG = LogFactory.getLog(InMemoryStoreConfiguration.class);

    public InMemoryStoreConfiguration() {
        LOG.info("Using in-memory storage");
    }

    @Bean
    public KeyValueStore<RegisteredClient> registeredClientStore() {
        return new InMemoryKeyValueStore<>(RegisteredClient.class);
    }

    @Bean
    public KeyValueStore<AuthorizationCode> authorizationCodeStore() {
        return new InMemoryKeyValueStore<>(AuthorizationCode.class);
    }

    @Bean
    public KeyValueStore<RefreshToken> refreshTokenStore() {
        return new InMemoryKeyValueStore<>(RefreshToken.class);
    }

    @Bean
    public KeyValueStore<RevokedAccessToken> revokedAccessTokenStore() {
        return new InMemoryKeyValueStore<>(RevokedAccessToken.class);
    }
}
