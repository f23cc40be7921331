package dev.taskgate.exception;

/** The install flow could not complete: provider error, bad state or failed code exchange. */
public class OAuthFlowException extends RuntimeException {
    public OAuthFlowException(String message) {
        super(message);
    }

    public OAuthFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
