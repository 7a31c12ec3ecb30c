package agentauth.exceptions;

public class UnknownCodeException extends InvalidGrantException {

    public UnknownCodeException() {
        super("Invalid or expired authorization code");
    }
}
