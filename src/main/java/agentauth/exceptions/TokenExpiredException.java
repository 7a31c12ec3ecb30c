package agentauth.exceptions;

public class TokenExpiredException extends InvalidGrantException {

    public TokenExpiredException(String message) {
        super(message);
    }
}
