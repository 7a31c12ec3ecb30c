package agentauth.model;

import lombok.Getter;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * A redirect URI registered by a client. A requested redirect URI is accepted when it equals
 * the registered one or extends it past a path segment or query boundary, so a registered
 * {@code https://a.example} never matches {@code https://a.example.evil.com/cb}.
 */
@Getter
public class ProvidedRedirectURI {

    private final String redirectURI;

    public ProvidedRedirectURI(String redirectURI) {
        this.redirectURI = redirectURI;
    }

    public boolean matches(String requested) {
        if (requested == null || !requested.startsWith(redirectURI)) {
            return false;
        }
        if (requested.length() == redirectURI.length() || redirectURI.endsWith("/")) {
            return true;
        }
        char next = requested.charAt(redirectURI.length());
        return next == '/' || next == '?' || (next == '&' && redirectURI.indexOf('?') > -1);
    }

    public static boolean isValid(String uri) {
        if (uri == null) {
            return false;
        }
        try {
            URI parsed = new URI(uri);
            //the authorization response is appended to the already encoded URI
            UriComponentsBuilder.fromUriString(uri).build(true);
            return parsed.isAbsolute() && parsed.getRawFragment() == null;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return redirectURI;
    }
}
