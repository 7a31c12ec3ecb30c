package agentauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class RegistrationDisabledException extends BaseException {

    public RegistrationDisabledException() {
        super("access_denied", "Dynamic client registration is disabled");
    }
}
