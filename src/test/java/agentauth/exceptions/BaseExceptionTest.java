package agentauth.exceptions;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class BaseExceptionTest {

    @Test
    public void errorCodes() {
        assertEquals("invalid_grant", new UnknownCodeException().getErrorCode());
        assertEquals("invalid_grant", new TokenExpiredException("expired").getErrorCode());
        assertEquals("invalid_client", new UnknownClientException("nope").getErrorCode());
        assertEquals("unsupported_grant_type", new UnsupportedGrantTypeException().getErrorCode());
        assertEquals("access_denied", new RegistrationDisabledException().getErrorCode());
        assertEquals("invalid_redirect_uri",
                InvalidClientMetadataException.invalidRedirectUri("redirect_uris is required").getErrorCode());
    }

    @Test
    public void noStackTrace() {
        assertEquals(0, new InvalidRequestException("code is required").getStackTrace().length);
    }

    @Test
    public void testToString() {
        assertEquals("InvalidGrantException invalid_grant: Invalid refresh token",
                new InvalidGrantException("Invalid refresh token").toString());
    }
}
