package agentauth.model;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProvidedRedirectURITest {

    @Test
    public void testMatchesExact() {
        ProvidedRedirectURI providedRedirectURI = new ProvidedRedirectURI("http://localhost:9000/callback");

        assertTrue(providedRedirectURI.matches("http://localhost:9000/callback"));
    }

    @Test
    public void testMatchesPrefix() {
        ProvidedRedirectURI providedRedirectURI = new ProvidedRedirectURI("http://localhost:9000/callback");

        assertTrue(providedRedirectURI.matches("http://localhost:9000/callback/nested"));
        assertTrue(providedRedirectURI.matches("http://localhost:9000/callback?session=1"));
    }

    @Test
    public void testNotMatches() {
        ProvidedRedirectURI providedRedirectURI = new ProvidedRedirectURI("http://localhost:9000/callback");

        assertFalse(providedRedirectURI.matches("http://localhost:9001/callback"));
        assertFalse(providedRedirectURI.matches("http://localhost:9000/call"));
        assertFalse(providedRedirectURI.matches(null));
    }

    @Test
    public void testNotMatchesHostExtension() {
        ProvidedRedirectURI providedRedirectURI = new ProvidedRedirectURI("https://a.example");

        assertFalse(providedRedirectURI.matches("https://a.example.evil.com/cb"));
        assertFalse(providedRedirectURI.matches("https://a.example:8443/cb"));
        assertTrue(providedRedirectURI.matches("https://a.example/cb"));
    }

    @Test
    public void testNotMatchesPathExtension() {
        ProvidedRedirectURI providedRedirectURI = new ProvidedRedirectURI("http://localhost:9000/callback");

        assertFalse(providedRedirectURI.matches("http://localhost:9000/callbackevil"));
        assertTrue(providedRedirectURI.matches("http://localhost:9000/callback/sub?x=1"));
    }

    @Test
    public void testMatchesTrailingSlash() {
        ProvidedRedirectURI providedRedirectURI = new ProvidedRedirectURI("https://a.example/");

        assertTrue(providedRedirectURI.matches("https://a.example/anything"));
    }

    @Test
    public void testMatchesExtraQueryParameter() {
        ProvidedRedirectURI providedRedirectURI = new ProvidedRedirectURI("https://a.example/cb?tenant=1");

        assertTrue(providedRedirectURI.matches("https://a.example/cb?tenant=1&session=2"));
        assertFalse(providedRedirectURI.matches("https://a.example/cb?tenant=12"));
    }

    @Test
    public void testIsValid() {
        assertTrue(ProvidedRedirectURI.isValid("http://localhost:9000/callback"));
        assertTrue(ProvidedRedirectURI.isValid("https://agent.example.com/oauth/callback?x=1"));
        assertTrue(ProvidedRedirectURI.isValid("com.example.agent:/callback"));
    }

    @Test
    public void testIsNotValid() {
        assertFalse(ProvidedRedirectURI.isValid(null));
        assertFalse(ProvidedRedirectURI.isValid("/callback"));
        assertFalse(ProvidedRedirectURI.isValid("http://localhost:9000/callback#fragment"));
        assertFalse(ProvidedRedirectURI.isValid("http://local host/callback"));
    }
}
