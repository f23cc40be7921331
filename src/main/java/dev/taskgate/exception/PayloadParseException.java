package dev.taskgate.exception;

/** Malformed webhook body. Never retried. */
public class PayloadParseException extends RuntimeException {
    private final String provider;

    public PayloadParseException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public PayloadParseException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() { return provider; }
}
