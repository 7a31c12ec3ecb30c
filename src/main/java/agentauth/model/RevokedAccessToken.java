package agentauth.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Date;

/**
 * Denylist entry for a revoked access token, kept until the token would have expired anyway.
 */
@NoArgsConstructor
@Getter
@Document(collection = "revoked_access_tokens")
public class RevokedAccessToken implements Expirable {

    @Id
    private String jwtId;

    private String clientId;

    private Date expiresIn;

    public RevokedAccessToken(String jwtId, String clientId, Date expiresIn) {
        this.jwtId = jwtId;
        this.clientId = clientId;
        this.expiresIn = expiresIn;
    }

    @Override
    public String getId() {
        return jwtId;
    }
}
