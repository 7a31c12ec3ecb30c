package agentauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class UnsupportedGrantTypeException extends BaseException {

    public UnsupportedGrantTypeException() {
        super("unsupported_grant_type", "grant_type must be \"authorization_code\" or \"refresh_token\"");
    }
}
