package dev.taskgate.exception;

public class UnknownProviderException extends RuntimeException {
    public UnknownProviderException(String provider) {
        super("Provider " + provider + " not supported");
    }
}
