package agentauth.user;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Local development only: every request is signed in as the configured user.
 */
@Component
@Profile("dev")
public class FakeWorkspaceSessionResolver implements WorkspaceSessionResolver {

    private final WorkspaceUser user;

    public FakeWorkspaceSessionResolver(@Value("${dev.user-id}") String userId,
                                        @Value("${dev.workspace-id}") String workspaceId) {
        this.user = new WorkspaceUser(userId, workspaceId);
    }

    @Override
    public Optional<WorkspaceUser> resolve(HttpServletRequest request) {
        return Optional.of(user);
    }
}
