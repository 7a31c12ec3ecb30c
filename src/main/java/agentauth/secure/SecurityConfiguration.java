package agentauth.secure;

import agentauth.log.MDCContextFilter;
import agentauth.user.WorkspaceSessionResolver;
import agentauth.web.WorkspaceAuthenticationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.www.BasicAuthenticationFilter;

/**
 * Client authentication happens in the endpoints and the end user is resolved from the platform session,
 * so the chain only contributes CORS, the MDC reset and the {@link WorkspaceAuthenticationFilter}.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfiguration {

    @Bean
    protected SecurityFilterChain oauthSecurityFilterChain(HttpSecurity http,
                                                           WorkspaceSessionResolver workspaceSessionResolver) throws Exception {
        return http
                .securityMatcher("/**")
                .cors(Customizer.withDefaults())
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .requestCache(AbstractHttpConfigurer::disable)
                .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
                .sessionManagement(session ->
                        session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .addFilterBefore(new MDCContextFilter(), BasicAuthenticationFilter.class)
                .addFilterBefore(new WorkspaceAuthenticationFilter(workspaceSessionResolver),
                        AnonymousAuthenticationFilter.class)
                .build();
    }
}
