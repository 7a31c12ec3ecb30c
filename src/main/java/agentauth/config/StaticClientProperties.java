package agentauth.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * The client provisioned out of band. Disabled when no client-id is configured. An empty list of
 * redirect-uris accepts any redirect_uri.
 */
@ConfigurationProperties(prefix = "static-client")
@Getter
@Setter
public class StaticClientProperties {

    private String clientId;
    private String clientSecret;
    private List<String> redirectUris = new ArrayList<>();

    public boolean isEnabled() {
        return StringUtils.hasText(clientId);
    }

    public boolean matches(String clientId) {
        return isEnabled() && this.clientId.equals(clientId);
    }
}
