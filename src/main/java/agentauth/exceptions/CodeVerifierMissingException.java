package agentauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class CodeVerifierMissingException extends BaseException {

    public CodeVerifierMissingException(String message) {
        super("invalid_request", message);
    }
}
