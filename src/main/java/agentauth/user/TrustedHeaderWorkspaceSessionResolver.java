package agentauth.user;

import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Reads the identity headers set by the authenticating front proxy of the platform. The proxy must strip
 * these headers from incoming requests.
 */
@Component
@Profile("!dev")
public class TrustedHeaderWorkspaceSessionResolver implements WorkspaceSessionResolver {

    private static final Log LOG = LogFactory.getLog(TrustedHeaderWorkspaceSessionResolver.class);

    private final String userIdHeader;
    private final String workspaceIdHeader;

    public TrustedHeaderWorkspaceSessionResolver(@Value("${session.user-id-header}") String userIdHeader,
                                                 @Value("${session.workspace-id-header}") String workspaceIdHeader) {
        this.userIdHeader = userIdHeader;
        this.workspaceIdHeader = workspaceIdHeader;
    }

    @Override
    public Optional<WorkspaceUser> resolve(HttpServletRequest request) {
        String userId = request.getHeader(userIdHeader);
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        String workspaceId = request.getHeader(workspaceIdHeader);
        if (!StringUtils.hasText(workspaceId)) {
            LOG.info(String.format("User %s has no active workspace, treating the session as anonymous", userId));
            return Optional.empty();
        }
        return Optional.of(new WorkspaceUser(userId, workspaceId));
    }
}
