package agentauth.endpoints;

import com.nimbusds.oauth2.sdk.GrantType;
import com.nimbusds.oauth2.sdk.auth.ClientAuthenticationMethod;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Authorization server metadata (RFC 8414), computed once from configuration.
 */
@RestController
public class DiscoveryEndpoint {

    private final Map<String, Object> metadata;

    public DiscoveryEndpoint(@Value("${base_url}") String baseUrl,
                             @Value("${scopes_supported}") List<String> scopesSupported) {
        String issuer = StringUtils.trimTrailingCharacter(baseUrl, '/');
        List<String> clientAuthenticationMethods = Arrays.asList(
                ClientAuthenticationMethod.CLIENT_SECRET_POST.getValue(),
                ClientAuthenticationMethod.CLIENT_SECRET_BASIC.getValue());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("issuer", issuer);
        result.put("authorization_endpoint", issuer + "/oauth/authorize");
        result.put("token_endpoint", issuer + "/oauth/token");
        result.put("registration_endpoint", issuer + "/oauth/register");
        result.put("revocation_endpoint", issuer + "/oauth/revoke");
        result.put("userinfo_endpoint", issuer + "/oauth/userinfo");
        result.put("response_types_supported", Collections.singletonList("code"));
        result.put("grant_types_supported",
                Arrays.asList(GrantType.AUTHORIZATION_CODE.getValue(), GrantType.REFRESH_TOKEN.getValue()));
        result.put("token_endpoint_auth_methods_supported", clientAuthenticationMethods);
        result.put("revocation_endpoint_auth_methods_supported", clientAuthenticationMethods);
        result.put("code_challenge_methods_supported",
                Arrays.asList(CodeChallengeMethod.S256.getValue(), CodeChallengeMethod.PLAIN.getValue()));
        result.put("scopes_supported", scopesSupported);
        this.metadata = Collections.unmodifiableMap(result);
    }

    @GetMapping("/.well-known/oauth-authorization-server")
    public ResponseEntity<Map<String, Object>> metadata() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS).cachePublic())
                .body(metadata);
    }
}
