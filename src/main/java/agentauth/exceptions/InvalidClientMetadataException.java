package agentauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Rejected dynamic client registration. The error code is either
 * {@code invalid_redirect_uri} or {@code invalid_client_metadata}.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidClientMetadataException extends BaseException {

    public static final String INVALID_REDIRECT_URI = "invalid_redirect_uri";
    public static final String INVALID_CLIENT_METADATA = "invalid_client_metadata";

    public InvalidClientMetadataException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static InvalidClientMetadataException invalidRedirectUri(String message) {
        return new InvalidClientMetadataException(INVALID_REDIRECT_URI, message);
    }

    public static InvalidClientMetadataException invalidClientMetadata(String message) {
        return new InvalidClientMetadataException(INVALID_CLIENT_METADATA, message);
    }
}
