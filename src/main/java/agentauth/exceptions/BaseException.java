package agentauth.exceptions;

/**
 * An OAuth error. The HTTP status comes from the {@code @ResponseStatus} of the subclass, the error code and
 * the message end up in the {@code error} and {@code error_description} of the response body.
 */
public abstract class BaseException extends RuntimeException {

    private final String errorCode;

    protected BaseException(String errorCode, String errorDescription) {
        super(errorDescription);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    //Client errors, the stack trace is never logged
    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " " + errorCode + ": " + getMessage();
    }
}
