package agentauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidRequestException extends BaseException {

    public InvalidRequestException(String message) {
        super("invalid_request", message);
    }
}
