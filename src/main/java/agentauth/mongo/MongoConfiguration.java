package agentauth.mongo;

import agentauth.model.AuthorizationCode;
import agentauth.model.RefreshToken;
import agentauth.model.RegisteredClient;
import agentauth.model.RevokedAccessToken;
import agentauth.repository.KeyValueStore;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

@Configuration
@ConditionalOnProperty(name = "storage.type", havingValue = "mongo")
public class MongoConfiguration {

    private static final Log LOG = LogFactory.getLog(MongoConfiguration.class);

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient(@Value("${spring.data.mongodb.uri}") String uri) {
        LOG.info("Using MongoDB storage");
        return MongoClients.create(uri);
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoClient mongoClient, @Value("${mongodb_db}") String databaseName) {
        return new MongoTemplate(mongoClient, databaseName);
    }

    @Bean
    public KeyValueStore<RegisteredClient> registeredClientStore(MongoTemplate mongoTemplate) {
        return new MongoKeyValueStore<>(mongoTemplate, RegisteredClient.class);
    }

    @Bean
    public KeyValueStore<AuthorizationCode> authorizationCodeStore(MongoTemplate mongoTemplate) {
        return new MongoKeyValueStore<>(mongoTemplate, AuthorizationCode.class);
    }

    @Bean
    public KeyValueStore<RefreshToken> refreshTokenStore(MongoTemplate mongoTemplate) {
        return new MongoKeyValueStore<>(mongoTemplate, RefreshToken.class);
    }

    @Bean
    public KeyValueStore<RevokedAccessToken> revokedAccessTokenStore(MongoTemplate mongoTemplate) {
        return new MongoKeyValueStore<>(mongoTemplate, RevokedAccessToken.class);
    }
}
