package agentauth.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Date;

@NoArgsConstructor
@Getter
@Document(collection = "refresh_tokens")
public class RefreshToken implements Expirable {

    @Id
    private String value;

    private String clientId;

    private String userId;

    private String workspaceId;

    private Date expiresIn;

    public RefreshToken(String value, String clientId, String userId, String workspaceId, Date expiresIn) {
        this.value = value;
        this.clientId = clientId;
        this.userId = userId;
        this.workspaceId = workspaceId;
        this.expiresIn = expiresIn;
    }

    @Override
    public String getId() {
        return value;
    }
}
