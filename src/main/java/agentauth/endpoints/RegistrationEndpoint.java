package agentauth.endpoints;

import agentauth.exceptions.InvalidClientMetadataException;
import agentauth.exceptions.RegistrationDisabledException;
import agentauth.log.MDCContext;
import agentauth.model.ClientMetadata;
import agentauth.model.ProvidedRedirectURI;
import agentauth.model.RegisteredClient;
import agentauth.repository.KeyValueStore;
import agentauth.secure.TokenGenerator;
import com.nimbusds.oauth2.sdk.GrantType;
import com.nimbusds.oauth2.sdk.auth.ClientAuthenticationMethod;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Open dynamic client registration (RFC 7591). Every request yields a new client, also when the same
 * redirect_uris were registered before.
 */
@RestController
public class RegistrationEndpoint {

    private static final Log LOG = LogFactory.getLog(RegistrationEndpoint.class);

    static final List<String> defaultGrantTypes =
            Arrays.asList(GrantType.AUTHORIZATION_CODE.getValue(), GrantType.REFRESH_TOKEN.getValue());
    static final List<String> defaultResponseTypes = Collections.singletonList("code");
    static final List<String> supportedAuthMethods = Arrays.asList(
            ClientAuthenticationMethod.CLIENT_SECRET_POST.getValue(),
            ClientAuthenticationMethod.CLIENT_SECRET_BASIC.getValue());

    private final KeyValueStore<RegisteredClient> registeredClientStore;
    private final TokenGenerator tokenGenerator;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final boolean registrationEnabled;
    private final List<String> allowedRedirectHosts;

    @Autowired
    public RegistrationEndpoint(KeyValueStore<RegisteredClient> registeredClientStore,
                                TokenGenerator tokenGenerator,
                                PasswordEncoder passwordEncoder,
                                Clock clock,
                                @Value("${registration.enabled}") boolean registrationEnabled,
                                @Value("${registration.allowed-redirect-hosts:}") List<String> allowedRedirectHosts) {
        this.registeredClientStore = registeredClientStore;
        this.tokenGenerator = tokenGenerator;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.registrationEnabled = registrationEnabled;
        this.allowedRedirectHosts = allowedRedirectHosts.stream()
                .filter(host -> !host.isBlank())
                .map(host -> host.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    @PostMapping(value = "oauth/register", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> register(@RequestBody Map<String, Object> body) {
        MDCContext.mdcContext("action", "Register");
        if (!registrationEnabled) {
            throw new RegistrationDisabledException();
        }
        ClientMetadata metadata = parseClientMetadata(body, allowedRedirectHosts);

        String clientId = tokenGenerator.generateClientId();
        String clientSecret = tokenGenerator.generateClientSecret();
        long clientIdIssuedAt = clock.instant().getEpochSecond();
        registeredClientStore.put(
                new RegisteredClient(clientId, passwordEncoder.encode(clientSecret), metadata, clientIdIssuedAt));

        MDCContext.mdcContext("client_id", clientId);
        LOG.info(String.format("Registered client %s (%s) with redirect URI's %s",
                clientId, metadata.getClientName(), metadata.getRedirectUris()));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("client_id", clientId);
        result.put("client_secret", clientSecret);
        result.put("client_id_issued_at", clientIdIssuedAt);
        result.put("client_secret_expires_at", 0);
        result.putAll(metadata.toJson());

        HttpHeaders headers = new HttpHeaders();
        headers.setCacheControl(CacheControl.noStore());
        headers.setPragma("no-cache");
        return new ResponseEntity<>(result, headers, HttpStatus.CREATED);
    }

    public static ClientMetadata parseClientMetadata(Map<String, Object> body, List<String> allowedRedirectHosts) {
        ClientMetadata metadata = new ClientMetadata();

        Object redirectUris = body.get("redirect_uris");
        if (!(redirectUris instanceof List) || ((List<?>) redirectUris).isEmpty()) {
            throw InvalidClientMetadataException.invalidRedirectUri("redirect_uris is required and must be a non-empty array");
        }
        List<String> uris = new ArrayList<>();
        for (Object uri : (List<?>) redirectUris) {
            if (!(uri instanceof String) || !ProvidedRedirectURI.isValid((String) uri)) {
                throw InvalidClientMetadataException.invalidRedirectUri(
                        String.format("Invalid redirect_uri %s, must be an absolute URI without fragment", uri));
            }
            String host = URI.create((String) uri).getHost();
            if (!allowedRedirectHosts.isEmpty() &&
                    (host == null || !allowedRedirectHosts.contains(host.toLowerCase(Locale.ROOT)))) {
                throw InvalidClientMetadataException.invalidRedirectUri(
                        String.format("Host of redirect_uri %s is not allowed", uri));
            }
            uris.add((String) uri);
        }
        metadata.setRedirectUris(uris);

        metadata.setClientName(stringValue(body, "client_name"));
        metadata.setGrantTypes(stringList(body, "grant_types", defaultGrantTypes));
        metadata.setResponseTypes(stringList(body, "response_types", defaultResponseTypes));

        String authMethod = stringValue(body, "token_endpoint_auth_method");
        if (authMethod == null || ClientAuthenticationMethod.NONE.getValue().equals(authMethod)) {
            //Secrets are always issued and required, public clients are served with client_secret_post
            authMethod = ClientAuthenticationMethod.CLIENT_SECRET_POST.getValue();
        } else if (!supportedAuthMethods.contains(authMethod)) {
            throw InvalidClientMetadataException.invalidClientMetadata(
                    String.format("Unsupported token_endpoint_auth_method %s", authMethod));
        }
        metadata.setTokenEndpointAuthMethod(authMethod);

        metadata.setScope(stringValue(body, "scope"));
        metadata.setContacts(stringList(body, "contacts", null));
        metadata.setLogoUri(stringValue(body, "logo_uri"));
        metadata.setClientUri(stringValue(body, "client_uri"));
        metadata.setPolicyUri(stringValue(body, "policy_uri"));
        metadata.setTosUri(stringValue(body, "tos_uri"));
        return metadata;
    }

    private static String stringValue(Map<String, Object> body, String name) {
        Object value = body.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw InvalidClientMetadataException.invalidClientMetadata(name + " must be a string");
        }
        return (String) value;
    }

    private static List<String> stringList(Map<String, Object> body, String name, List<String> defaultValue) {
        Object value = body.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof List) || ((List<?>) value).stream().anyMatch(v -> !(v instanceof String))) {
            throw InvalidClientMetadataException.invalidClientMetadata(name + " must be an array of strings");
        }
        List<String> result = ((List<?>) value).stream().map(String.class::cast).collect(Collectors.toList());
        return result.isEmpty() && defaultValue != null ? defaultValue : result;
    }
}
