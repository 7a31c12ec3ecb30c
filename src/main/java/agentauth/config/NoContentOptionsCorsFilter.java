package agentauth.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpMethod;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.CorsProcessor;
import org.springframework.web.cors.DefaultCorsProcessor;
import org.springframework.web.filter.CorsFilter;

import java.io.IOException;

/**
 * Answers every OPTIONS request with 204 and the CORS headers, whether or not it is a real preflight.
 * Rejected preflights keep the 403 of the {@link DefaultCorsProcessor}.
 */
public class NoContentOptionsCorsFilter extends CorsFilter {

    private final CorsConfigurationSource configSource;
    private final CorsProcessor processor = new DefaultCorsProcessor();

    public NoContentOptionsCorsFilter(CorsConfigurationSource configSource) {
        super(configSource);
        this.configSource = configSource;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (!HttpMethod.OPTIONS.matches(request.getMethod())) {
            super.doFilterInternal(request, response, filterChain);
            return;
        }
        if (processor.processRequest(configSource.getCorsConfiguration(request), request, response)) {
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
        }
    }
}
