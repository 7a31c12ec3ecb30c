package agentauth.log;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Starts every request on a pooled worker thread with an MDC that only holds the request line. The endpoints
 * add the action, the client and the workspace user once they are known.
 */
public class MDCContextFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        MDC.clear();
        MDC.put("path", String.format("%s %s", request.getMethod(), request.getRequestURI()));
        //not cleared afterwards, the error dispatch logs with the context of the failed request
        filterChain.doFilter(request, response);
    }
}
