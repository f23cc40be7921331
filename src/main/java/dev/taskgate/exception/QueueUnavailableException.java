package dev.taskgate.exception;

/** The queue backend cannot be reached. Callers retry with bounded backoff; messages are never dropped silently. */
public class QueueUnavailableException extends RuntimeException {
    public QueueUnavailableException(String message) {
        super(message);
    }

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
