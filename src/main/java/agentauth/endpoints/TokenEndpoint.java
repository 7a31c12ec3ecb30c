package agentauth.endpoints;

import agentauth.config.StaticClientProperties;
import agentauth.exceptions.CodeVerifierMissingException;
import agentauth.exceptions.InvalidGrantException;
import agentauth.exceptions.InvalidRequestException;
import agentauth.exceptions.TokenExpiredException;
import agentauth.exceptions.UnknownCodeException;
import agentauth.exceptions.UnsupportedGrantTypeException;
import agentauth.log.MDCContext;
import agentauth.model.AuthorizationCode;
import agentauth.model.RefreshToken;
import agentauth.model.RegisteredClient;
import agentauth.repository.KeyValueStore;
import agentauth.secure.TokenGenerator;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.oauth2.sdk.GrantType;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import jakarta.servlet.http.HttpServletRequest;
import lombok.SneakyThrows;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@RestController
public class TokenEndpoint extends SecureEndpoint implements OAuthEndpoint {

    private static final Log LOG = LogFactory.getLog(TokenEndpoint.class);

    private final KeyValueStore<AuthorizationCode> authorizationCodeStore;
    private final KeyValueStore<RefreshToken> refreshTokenStore;
    private final TokenGenerator tokenGenerator;
    private final Clock clock;
    private final int refreshTokenValidityDays;

    @Autowired
    public TokenEndpoint(KeyValueStore<RegisteredClient> registeredClientStore,
                         KeyValueStore<AuthorizationCode> authorizationCodeStore,
                         KeyValueStore<RefreshToken> refreshTokenStore,
                         StaticClientProperties staticClientProperties,
                         PasswordEncoder passwordEncoder,
                         TokenGenerator tokenGenerator,
                         Clock clock,
                         @Value("${token.refresh-token-validity-days}") int refreshTokenValidityDays) {
        super(registeredClientStore, staticClientProperties, passwordEncoder);
        this.authorizationCodeStore = authorizationCodeStore;
        this.refreshTokenStore = refreshTokenStore;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
        this.refreshTokenValidityDays = refreshTokenValidityDays;
    }

    @PostMapping(value = "oauth/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Map<String, Object>> token(@RequestParam Map<String, String> parameters,
                                                     HttpServletRequest request) {
        return doToken(parameters, request);
    }

    @PostMapping(value = "oauth/token", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> tokenJson(@RequestBody Map<String, Object> body,
                                                         HttpServletRequest request) {
        Map<String, String> parameters = new HashMap<>();
        body.forEach((key, value) -> {
            if (value != null) {
                parameters.put(key, String.valueOf(value));
            }
        });
        return doToken(parameters, request);
    }

    private ResponseEntity<Map<String, Object>> doToken(Map<String, String> parameters, HttpServletRequest request) {
        MDCContext.mdcContext("action", "Token");
        RegisteredClient client = authenticateClient(parameters, request);

        String grantType = parameters.get("grant_type");
        MDCContext.mdcContext("client_id", client.getClientId(), "grant", grantType);

        if (GrantType.AUTHORIZATION_CODE.getValue().equals(grantType)) {
            return handleAuthorizationCodeGrant(parameters, client);
        } else if (GrantType.REFRESH_TOKEN.getValue().equals(grantType)) {
            return handleRefreshTokenGrant(parameters, client);
        }
        throw new UnsupportedGrantTypeException();
    }

    private ResponseEntity<Map<String, Object>> handleAuthorizationCodeGrant(Map<String, String> parameters,
                                                                             RegisteredClient client) {
        String code = parameters.get("code");
        if (!StringUtils.hasText(code)) {
            throw new InvalidRequestException("code is required");
        }
        AuthorizationCode authorizationCode = authorizationCodeStore.find(code).orElseThrow(UnknownCodeException::new);

        if (authorizationCode.isExpired(clock)) {
            authorizationCodeStore.delete(code);
            throw new TokenExpiredException("Authorization code has expired");
        }
        if (!authorizationCode.getClientId().equals(client.getClientId())) {
            LOG.warn(String.format("Client %s presented an authorization code issued to client %s",
                    client.getClientId(), authorizationCode.getClientId()));
            throw new InvalidGrantException("Authorization code was not issued to this client");
        }
        String redirectUri = parameters.get("redirect_uri");
        if (StringUtils.hasText(redirectUri) && !redirectUri.equals(authorizationCode.getRedirectUri())) {
            throw new InvalidGrantException("redirect_uri mismatch");
        }
        String codeChallenge = authorizationCode.getCodeChallenge();
        if (codeChallenge != null) {
            String codeVerifier = parameters.get("code_verifier");
            if (!StringUtils.hasText(codeVerifier)) {
                throw new CodeVerifierMissingException("code_verifier is required");
            }
            if (!codeVerifierMatches(codeVerifier, codeChallenge, authorizationCode.getCodeChallengeMethod())) {
                throw new InvalidGrantException("Invalid code_verifier");
            }
        }
        //Single use is enforced here, concurrent redemptions of the same code race on the atomic removal
        AuthorizationCode redeemed = authorizationCodeStore.getAndDelete(code).orElseThrow(UnknownCodeException::new);
        MDCContext.mdcContext("user_id", redeemed.getUserId(), "workspace_id", redeemed.getWorkspaceId());

        Map<String, Object> body = tokenEndpointResponse(client, redeemed.getUserId(), redeemed.getWorkspaceId());
        LOG.info(String.format("Issued tokens to client %s with grant authorization_code", client.getClientId()));
        return new ResponseEntity<>(body, getResponseHeaders(), HttpStatus.OK);
    }

    private ResponseEntity<Map<String, Object>> handleRefreshTokenGrant(Map<String, String> parameters,
                                                                        RegisteredClient client) {
        String refreshTokenValue = parameters.get("refresh_token");
        if (!StringUtils.hasText(refreshTokenValue)) {
            throw new InvalidRequestException("refresh_token is required");
        }
        RefreshToken refreshToken = refreshTokenStore.find(refreshTokenValue)
                .orElseThrow(() -> new InvalidGrantException("Invalid refresh token"));
        if (!refreshToken.getClientId().equals(client.getClientId())) {
            LOG.warn(String.format("Client %s presented a refresh token issued to client %s",
                    client.getClientId(), refreshToken.getClientId()));
            throw new InvalidGrantException("Invalid refresh token");
        }
        //Rotation, the presented token is gone even if it turns out to be expired
        RefreshToken rotated = refreshTokenStore.getAndDelete(refreshTokenValue)
                .orElseThrow(() -> new InvalidGrantException("Invalid refresh token"));
        if (rotated.isExpired(clock)) {
            throw new TokenExpiredException("Refresh token has expired");
        }
        MDCContext.mdcContext("user_id", rotated.getUserId(), "workspace_id", rotated.getWorkspaceId());

        Map<String, Object> body = tokenEndpointResponse(client, rotated.getUserId(), rotated.getWorkspaceId());
        LOG.info(String.format("Issued tokens to client %s with grant refresh_token", client.getClientId()));
        return new ResponseEntity<>(body, getResponseHeaders(), HttpStatus.OK);
    }

    static boolean codeVerifierMatches(String codeVerifier, String codeChallenge, String codeChallengeMethod) {
        CodeChallengeMethod method = codeChallengeMethod != null ?
                CodeChallengeMethod.parse(codeChallengeMethod) : CodeChallengeMethod.PLAIN;
        String computed = CodeChallengeMethod.S256.equals(method) ? s256(codeVerifier) : codeVerifier;
        //Constant time comparison, no length rule on the verifier
        return MessageDigest.isEqual(codeChallenge.getBytes(StandardCharsets.UTF_8),
                computed.getBytes(StandardCharsets.UTF_8));
    }

    @SneakyThrows
    private static String s256(String codeVerifier) {
        byte[] digest = MessageDigest.getInstance("SHA-256").digest(codeVerifier.getBytes(StandardCharsets.UTF_8));
        return Base64URL.encode(digest).toString();
    }

    @Override
    public TokenGenerator getTokenGenerator() {
        return tokenGenerator;
    }

    @Override
    public KeyValueStore<RefreshToken> getRefreshTokenStore() {
        return refreshTokenStore;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public int getRefreshTokenValidityDays() {
        return refreshTokenValidityDays;
    }
}
