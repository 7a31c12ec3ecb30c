package agentauth.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Date;

@NoArgsConstructor
@Getter
@Document(collection = "authorization_codes")
public class AuthorizationCode implements Expirable {

    @Id
    private String code;

    private String clientId;

    private String userId;

    private String workspaceId;

    private String redirectUri;

    private String codeChallenge;

    private String codeChallengeMethod;

    private Date expiresIn;

    public AuthorizationCode(String code, String clientId, String userId, String workspaceId, String redirectUri,
                             String codeChallenge, String codeChallengeMethod, Date expiresIn) {
        this.code = code;
        this.clientId = clientId;
        this.userId = userId;
        this.workspaceId = workspaceId;
        this.redirectUri = redirectUri;
        this.codeChallenge = codeChallenge;
        this.codeChallengeMethod = codeChallengeMethod;
        this.expiresIn = expiresIn;
    }

    @Override
    public String getId() {
        return code;
    }
}
