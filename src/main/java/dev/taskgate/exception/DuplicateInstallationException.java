package dev.taskgate.exception;

public class DuplicateInstallationException extends RuntimeException {
    public DuplicateInstallationException(String platform, String organizationId) {
        super("Active %s installation already exists for organization %s".formatted(platform, organizationId));
    }
}
