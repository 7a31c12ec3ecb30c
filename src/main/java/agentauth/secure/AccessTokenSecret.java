package agentauth.secure;

import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;

final class AccessTokenSecret {

    private AccessTokenSecret() {
    }

    static byte[] bytes(String secret) {
        if (!StringUtils.hasText(secret)) {
            throw new IllegalStateException("Property access_token_secret is required to sign access tokens");
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}
