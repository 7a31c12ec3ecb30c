package agentauth.endpoints;

import agentauth.config.StaticClientProperties;
import agentauth.exceptions.InvalidRequestException;
import agentauth.exceptions.RedirectMismatchException;
import agentauth.exceptions.UnknownClientException;
import agentauth.log.MDCContext;
import agentauth.model.AuthorizationCode;
import agentauth.model.ProvidedRedirectURI;
import agentauth.model.RefreshToken;
import agentauth.model.RegisteredClient;
import agentauth.repository.KeyValueStore;
import agentauth.secure.TokenGenerator;
import agentauth.user.WorkspaceAuthentication;
import agentauth.user.WorkspaceUser;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.Authentication;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Controller;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.view.RedirectView;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;

@Controller
public class AuthorizationEndpoint extends SecureEndpoint implements OAuthEndpoint {

    private static final Log LOG = LogFactory.getLog(AuthorizationEndpoint.class);

    private static final List<String> supportedCodeChallengeMethods =
            Arrays.asList(CodeChallengeMethod.S256.getValue(), CodeChallengeMethod.PLAIN.getValue());

    private final KeyValueStore<AuthorizationCode> authorizationCodeStore;
    private final KeyValueStore<RefreshToken> refreshTokenStore;
    private final TokenGenerator tokenGenerator;
    private final Clock clock;
    private final String baseUrl;
    private final String loginUrl;
    private final String loginReturnParameter;
    private final int authorizationCodeValidityMinutes;

    @Autowired
    public AuthorizationEndpoint(KeyValueStore<RegisteredClient> registeredClientStore,
                                 KeyValueStore<AuthorizationCode> authorizationCodeStore,
                                 KeyValueStore<RefreshToken> refreshTokenStore,
                                 StaticClientProperties staticClientProperties,
                                 PasswordEncoder passwordEncoder,
                                 TokenGenerator tokenGenerator,
                                 Clock clock,
                                 @Value("${base_url}") String baseUrl,
                                 @Value("${login.url}") String loginUrl,
                                 @Value("${login.return-parameter}") String loginReturnParameter,
                                 @Value("${token.authorization-code-validity-minutes}") int authorizationCodeValidityMinutes) {
        super(registeredClientStore, staticClientProperties, passwordEncoder);
        this.authorizationCodeStore = authorizationCodeStore;
        this.refreshTokenStore = refreshTokenStore;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
        this.baseUrl = StringUtils.trimTrailingCharacter(baseUrl, '/');
        this.loginUrl = loginUrl;
        this.loginReturnParameter = loginReturnParameter;
        this.authorizationCodeValidityMinutes = authorizationCodeValidityMinutes;
    }

    @GetMapping("/oauth/authorize")
    public ModelAndView authorize(@RequestParam MultiValueMap<String, String> parameters,
                                  Authentication authentication,
                                  HttpServletRequest request) {
        MDCContext.mdcContext("action", "Authorize");

        if (!"code".equals(parameters.getFirst("response_type"))) {
            throw new InvalidRequestException("response_type must be \"code\"");
        }
        String clientId = parameters.getFirst("client_id");
        String redirectUri = parameters.getFirst("redirect_uri");
        if (!StringUtils.hasText(clientId) || !StringUtils.hasText(redirectUri)) {
            throw new InvalidRequestException("client_id and redirect_uri are required");
        }
        MDCContext.mdcContext("client_id", clientId);
        RegisteredClient client = resolveClient(clientId).orElseThrow(() -> new UnknownClientException(clientId));
        validateRedirectionURI(redirectUri, client);

        String codeChallenge = parameters.getFirst("code_challenge");
        String codeChallengeMethod = validateCodeChallengeMethod(codeChallenge, parameters.getFirst("code_challenge_method"));

        if (!(authentication instanceof WorkspaceAuthentication)) {
            String loginRedirect = loginRedirect(request);
            LOG.info(String.format("Unauthenticated authorization request from client %s, redirecting to login", clientId));
            return new ModelAndView(redirectView(loginRedirect));
        }
        WorkspaceUser user = ((WorkspaceAuthentication) authentication).getUser();
        MDCContext.mdcContext(user);

        AuthorizationCode authorizationCode = constructAuthorizationCode(client, user, redirectUri, codeChallenge, codeChallengeMethod);
        authorizationCodeStore.put(authorizationCode);
        LOG.info(String.format("Issued authorization code to client %s for user %s in workspace %s",
                clientId, user.getUserId(), user.getWorkspaceId()));

        return new ModelAndView(redirectView(authorizationRedirect(redirectUri, parameters.getFirst("state"),
                authorizationCode.getCode())));
    }

    /**
     * Clients without registered redirect URIs accept any redirect_uri. This only applies to a static client
     * configured without redirect-uris.
     */
    public static ProvidedRedirectURI validateRedirectionURI(String redirectUri, RegisteredClient client) {
        if (!ProvidedRedirectURI.isValid(redirectUri)) {
            throw new InvalidRequestException("redirect_uri must be an absolute URI");
        }
        List<String> registeredRedirectUris = client.getRedirectUris();
        if (client.isStaticClient() && registeredRedirectUris.isEmpty()) {
            return new ProvidedRedirectURI(redirectUri);
        }
        return registeredRedirectUris.stream()
                .map(ProvidedRedirectURI::new)
                .filter(providedRedirectURI -> providedRedirectURI.matches(redirectUri))
                .findFirst()
                .orElseThrow(() -> {
                    LOG.warn(String.format("Client %s with registered redirect URI's %s requested authorization with redirectURI %s",
                            client.getClientId(), registeredRedirectUris, redirectUri));
                    return new RedirectMismatchException("redirect_uri does not match a registered redirect URI");
                });
    }

    static String validateCodeChallengeMethod(String codeChallenge, String codeChallengeMethod) {
        if (!StringUtils.hasText(codeChallenge)) {
            return null;
        }
        if (!StringUtils.hasText(codeChallengeMethod)) {
            return CodeChallengeMethod.getDefault().getValue();
        }
        if (!supportedCodeChallengeMethods.contains(codeChallengeMethod)) {
            throw new InvalidRequestException("code_challenge_method must be \"S256\" or \"plain\"");
        }
        return codeChallengeMethod;
    }

    private String loginRedirect(HttpServletRequest request) {
        String query = request.getQueryString();
        String returnUrl = baseUrl + request.getRequestURI() + (StringUtils.hasText(query) ? "?" + query : "");
        return UriComponentsBuilder.fromUriString(loginUrl)
                .queryParam(loginReturnParameter, UriUtils.encodeQueryParam(returnUrl, StandardCharsets.UTF_8))
                .build(true)
                .toUriString();
    }

    private String authorizationRedirect(String redirectURI, String state, String code) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(redirectURI);
        builder.queryParam("code", code);
        if (StringUtils.hasText(state)) {
            builder.queryParam("state", UriUtils.encodeQueryParam(state, StandardCharsets.UTF_8));
        }
        return builder.build(true).toUriString();
    }

    private RedirectView redirectView(String url) {
        RedirectView redirectView = new RedirectView(url);
        redirectView.setExpandUriTemplateVariables(false);
        return redirectView;
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
    public int getAuthorizationCodeValidityMinutes() {
        return authorizationCodeValidityMinutes;
    }
}
