package dev.taskgate.exception;

/**
 * The upstream refresh call failed. {@code permanent} marks revoked or invalid credentials,
 * which deactivate the installation instead of being retried.
 */
public class TokenRefreshException extends RuntimeException {
    private final boolean permanent;

    public TokenRefreshException(String message, boolean permanent) {
        super(message);
        this.permanent = permanent;
    }

    public TokenRefreshException(String message, boolean permanent, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
    }

    public boolean isPermanent() { return permanent; }
}
