package agentauth.web;

import agentauth.log.MDCContext;
import agentauth.user.WorkspaceAuthentication;
import agentauth.user.WorkspaceSessionResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.GenericFilterBean;

import java.io.IOException;

public class WorkspaceAuthenticationFilter extends GenericFilterBean {

    private final WorkspaceSessionResolver workspaceSessionResolver;

    public WorkspaceAuthenticationFilter(WorkspaceSessionResolver workspaceSessionResolver) {
        this.workspaceSessionResolver = workspaceSessionResolver;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain) throws IOException, ServletException {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (!(authentication instanceof WorkspaceAuthentication)) {
            workspaceSessionResolver.resolve((HttpServletRequest) request).ifPresent(user -> {
                MDCContext.mdcContext(user);
                SecurityContextHolder.getContext().setAuthentication(new WorkspaceAuthentication(user));
            });
        }
        chain.doFilter(request, response);
    }
}
