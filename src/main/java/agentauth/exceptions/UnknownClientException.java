package agentauth.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class UnknownClientException extends BaseException {

    public UnknownClientException(String clientId) {
        super("invalid_client", "Invalid client_id");
    }
}
