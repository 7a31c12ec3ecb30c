package agentauth.model;

import lombok.Getter;

import java.util.Date;

@Getter
public class VerifiedAccessToken {

    private final String jwtId;
    private final String userId;
    private final String workspaceId;
    private final String clientId;
    private final Date expiresIn;

    public VerifiedAccessToken(String jwtId, String userId, String workspaceId, String clientId, Date expiresIn) {
        this.jwtId = jwtId;
        this.userId = userId;
        this.workspaceId = workspaceId;
        this.clientId = clientId;
        this.expiresIn = expiresIn;
    }
}
