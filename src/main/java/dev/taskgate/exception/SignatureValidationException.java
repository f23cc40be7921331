package dev.taskgate.exception;

/** Forged request or misconfigured secret. Never retried. */
public class SignatureValidationException extends RuntimeException {
    private final String provider;

    public SignatureValidationException(String provider) {
        super("Invalid webhook signature for provider " + provider);
        this.provider = provider;
    }

    public String getProvider() { return provider; }
}
