package agentauth.endpoints;

import agentauth.config.StaticClientProperties;
import agentauth.exceptions.InvalidRequestException;
import agentauth.log.MDCContext;
import agentauth.model.RefreshToken;
import agentauth.model.RegisteredClient;
import agentauth.model.RevokedAccessToken;
import agentauth.model.VerifiedAccessToken;
import agentauth.repository.KeyValueStore;
import agentauth.secure.AccessTokenVerifier;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Token revocation (RFC 7009). Refresh tokens are deleted, access tokens are put on a denylist until
 * they expire. Unknown tokens are not an error.
 */
@RestController
public class RevocationEndpoint extends SecureEndpoint {

    private static final Log LOG = LogFactory.getLog(RevocationEndpoint.class);

    private final KeyValueStore<RefreshToken> refreshTokenStore;
    private final KeyValueStore<RevokedAccessToken> revokedAccessTokenStore;
    private final AccessTokenVerifier accessTokenVerifier;

    @Autowired
    public RevocationEndpoint(KeyValueStore<RegisteredClient> registeredClientStore,
                              KeyValueStore<RefreshToken> refreshTokenStore,
                              KeyValueStore<RevokedAccessToken> revokedAccessTokenStore,
                              StaticClientProperties staticClientProperties,
                              PasswordEncoder passwordEncoder,
                              AccessTokenVerifier accessTokenVerifier) {
        super(registeredClientStore, staticClientProperties, passwordEncoder);
        this.refreshTokenStore = refreshTokenStore;
        this.revokedAccessTokenStore = revokedAccessTokenStore;
        this.accessTokenVerifier = accessTokenVerifier;
    }

    @PostMapping(value = "oauth/revoke", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Void> revoke(@RequestParam Map<String, String> parameters, HttpServletRequest request) {
        MDCContext.mdcContext("action", "Revoke");
        RegisteredClient client = authenticateClient(parameters, request);
        MDCContext.mdcContext("client_id", client.getClientId());

        String token = parameters.get("token");
        if (!StringUtils.hasText(token)) {
            throw new InvalidRequestException("token is required");
        }
        boolean revoked = "access_token".equals(parameters.get("token_type_hint")) ?
                revokeAccessToken(token, client) || revokeRefreshToken(token, client) :
                revokeRefreshToken(token, client) || revokeAccessToken(token, client);
        if (!revoked) {
            LOG.info(String.format("Ignoring revocation of unknown token by client %s", client.getClientId()));
        }
        return ResponseEntity.ok().build();
    }

    private boolean revokeRefreshToken(String token, RegisteredClient client) {
        Optional<RefreshToken> refreshToken = refreshTokenStore.find(token)
                .filter(rt -> rt.getClientId().equals(client.getClientId()));
        refreshToken.ifPresent(rt -> {
            refreshTokenStore.delete(rt.getValue());
            LOG.info(String.format("Revoked refresh token of client %s", client.getClientId()));
        });
        return refreshToken.isPresent();
    }

    private boolean revokeAccessToken(String token, RegisteredClient client) {
        Optional<VerifiedAccessToken> accessToken = accessTokenVerifier.verify(token)
                .filter(at -> at.getJwtId() != null && client.getClientId().equals(at.getClientId()));
        accessToken.ifPresent(at -> {
            revokedAccessTokenStore.put(new RevokedAccessToken(at.getJwtId(), client.getClientId(), at.getExpiresIn()));
            LOG.info(String.format("Revoked access token %s of client %s", at.getJwtId(), client.getClientId()));
        });
        return accessToken.isPresent();
    }
}
