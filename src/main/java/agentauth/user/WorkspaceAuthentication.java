package agentauth.user;

import lombok.Getter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

@Getter
public class WorkspaceAuthentication extends AbstractAuthenticationToken {

    private final WorkspaceUser user;

    public WorkspaceAuthentication(WorkspaceUser user) {
        super(AuthorityUtils.createAuthorityList("ROLE_USER"));
        this.user = user;
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return "N/A";
    }

    @Override
    public Object getPrincipal() {
        return user.getUserId();
    }
}
