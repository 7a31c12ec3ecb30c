package agentauth.user;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Resolves the end user of the platform session that carries an authorization request.
 */
public interface WorkspaceSessionResolver {

    Optional<WorkspaceUser> resolve(HttpServletRequest request);
}
