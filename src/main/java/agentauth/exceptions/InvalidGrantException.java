package agentauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidGrantException extends BaseException {

    public InvalidGrantException(String message) {
        super("invalid_grant", message);
    }
}
