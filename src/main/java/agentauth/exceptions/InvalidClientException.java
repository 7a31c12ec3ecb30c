package agentauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class InvalidClientException extends BaseException {

    public InvalidClientException(String message) {
        super("invalid_client", message);
    }
}
