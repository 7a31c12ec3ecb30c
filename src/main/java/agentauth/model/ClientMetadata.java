package agentauth.model;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated client metadata of a registration request, with defaults applied.
 */
@Getter
@Setter
public class ClientMetadata {

    private String clientName;
    private List<String> redirectUris;
    private List<String> grantTypes;
    private List<String> responseTypes;
    private String tokenEndpointAuthMethod;
    private String scope;
    private List<String> contacts;
    private String logoUri;
    private String clientUri;
    private String policyUri;
    private String tosUri;

    public Map<String, Object> toJson() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (clientName != null) {
            result.put("client_name", clientName);
        }
        result.put("redirect_uris", redirectUris);
        result.put("grant_types", grantTypes);
        result.put("response_types", responseTypes);
        result.put("token_endpoint_auth_method", tokenEndpointAuthMethod);
        putIfPresent(result, "scope", scope);
        putIfPresent(result, "contacts", contacts);
        putIfPresent(result, "logo_uri", logoUri);
        putIfPresent(result, "client_uri", clientUri);
        putIfPresent(result, "policy_uri", policyUri);
        putIfPresent(result, "tos_uri", tosUri);
        return result;
    }

    private void putIfPresent(Map<String, Object> result, String key, Object value) {
        if (value != null) {
            result.put(key, value);
        }
    }
}
