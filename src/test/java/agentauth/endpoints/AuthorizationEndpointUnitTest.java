package agentauth.endpoints;

import agentauth.exceptions.InvalidRequestException;
import agentauth.exceptions.RedirectMismatchException;
import agentauth.model.ClientMetadata;
import agentauth.model.RegisteredClient;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class AuthorizationEndpointUnitTest {

    @Test
    public void validateRedirectionURI() {
        assertEquals("http://localhost:9000/callback",
                AuthorizationEndpoint.validateRedirectionURI("http://localhost:9000/callback/x", client("http://localhost:9000/callback"))
                        .getRedirectURI());
    }

    @Test
    public void validateRedirectionURIMultiple() {
        RegisteredClient client = client("http://localhost:9000/callback", "https://agent.example.com/oauth");
        assertEquals("https://agent.example.com/oauth",
                AuthorizationEndpoint.validateRedirectionURI("https://agent.example.com/oauth", client).getRedirectURI());
    }

    @Test(expected = RedirectMismatchException.class)
    public void validateRedirectionURIMismatch() {
        AuthorizationEndpoint.validateRedirectionURI("http://localhost:9001/callback", client("http://localhost:9000/callback"));
    }

    @Test(expected = InvalidRequestException.class)
    public void validateRedirectionURIRelative() {
        AuthorizationEndpoint.validateRedirectionURI("/callback", client("http://localhost:9000/callback"));
    }

    @Test
    public void staticClientWithoutRedirectUrisAcceptsAny() {
        RegisteredClient client = RegisteredClient.staticClient("static", Collections.emptyList());
        assertEquals("https://anything.example.com/cb",
                AuthorizationEndpoint.validateRedirectionURI("https://anything.example.com/cb", client).getRedirectURI());
    }

    @Test
    public void validateCodeChallengeMethod() {
        assertNull(AuthorizationEndpoint.validateCodeChallengeMethod(null, "S256"));
        assertEquals("plain", AuthorizationEndpoint.validateCodeChallengeMethod("challenge", null));
        assertEquals("S256", AuthorizationEndpoint.validateCodeChallengeMethod("challenge", "S256"));
        assertEquals("plain", AuthorizationEndpoint.validateCodeChallengeMethod("challenge", "plain"));
    }

    @Test(expected = InvalidRequestException.class)
    public void validateCodeChallengeMethodUnsupported() {
        AuthorizationEndpoint.validateCodeChallengeMethod("challenge", "s256");
    }

    private RegisteredClient client(String... redirectUris) {
        ClientMetadata metadata = new ClientMetadata();
        metadata.setRedirectUris(Arrays.asList(redirectUris));
        return new RegisteredClient("client", "secret", metadata, 0L);
    }
}
