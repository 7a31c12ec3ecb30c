package agentauth.user;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The signed-in end user together with the workspace that is active in their session.
 */
@Getter
@EqualsAndHashCode
@ToString
public class WorkspaceUser {

    private final String userId;
    private final String workspaceId;

    public WorkspaceUser(String userId, String workspaceId) {
        this.userId = userId;
        this.workspaceId = workspaceId;
    }
}
