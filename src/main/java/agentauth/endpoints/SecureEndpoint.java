package agentauth.endpoints;

import agentauth.config.StaticClientProperties;
import agentauth.exceptions.InvalidClientException;
import agentauth.exceptions.InvalidRequestException;
import agentauth.exceptions.UnknownClientException;
import agentauth.model.RegisteredClient;
import agentauth.repository.KeyValueStore;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.auth.ClientSecretBasic;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves clients, either the configured static client or a dynamically registered one, and authenticates
 * them with client_secret_post or client_secret_basic.
 */
public class SecureEndpoint {

    private static final Log LOG = LogFactory.getLog(SecureEndpoint.class);

    private final KeyValueStore<RegisteredClient> registeredClientStore;
    private final StaticClientProperties staticClient;
    private final PasswordEncoder passwordEncoder;

    public SecureEndpoint(KeyValueStore<RegisteredClient> registeredClientStore,
                          StaticClientProperties staticClient,
                          PasswordEncoder passwordEncoder) {
        this.registeredClientStore = registeredClientStore;
        this.staticClient = staticClient;
        this.passwordEncoder = passwordEncoder;
    }

    Optional<RegisteredClient> resolveClient(String clientId) {
        if (staticClient.matches(clientId)) {
            return Optional.of(RegisteredClient.staticClient(clientId, staticClient.getRedirectUris()));
        }
        return registeredClientStore.find(clientId);
    }

    RegisteredClient authenticateClient(Map<String, String> parameters, HttpServletRequest request) {
        String clientId = parameters.get("client_id");
        String clientSecret = parameters.get("client_secret");
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, "Basic ", 0, 6)) {
            try {
                ClientSecretBasic clientSecretBasic = ClientSecretBasic.parse(authorization);
                clientId = clientSecretBasic.getClientID().getValue();
                clientSecret = clientSecretBasic.getClientSecret().getValue();
            } catch (ParseException e) {
                throw new InvalidClientException("Invalid Basic authorization header");
            }
        }
        if (!StringUtils.hasText(clientId)) {
            throw new InvalidRequestException("client_id is required");
        }
        String id = clientId;
        RegisteredClient client = resolveClient(id).orElseThrow(() -> new UnknownClientException(id));
        if (client.isStaticClient()) {
            String configuredSecret = staticClient.getClientSecret();
            //Absent caller secret is tolerated for public deployments of the static client
            if (StringUtils.hasText(configuredSecret) && StringUtils.hasText(clientSecret) &&
                    !MessageDigest.isEqual(configuredSecret.getBytes(StandardCharsets.UTF_8),
                            clientSecret.getBytes(StandardCharsets.UTF_8))) {
                LOG.warn(String.format("Invalid client_secret for static client %s", clientId));
                throw new InvalidClientException("Invalid client_secret");
            }
            return client;
        }
        if (!StringUtils.hasText(clientSecret) || !passwordEncoder.matches(clientSecret, client.getSecret())) {
            LOG.warn(String.format("Invalid or missing client_secret for client %s", clientId));
            throw new InvalidClientException("Invalid client_secret");
        }
        return client;
    }
}
