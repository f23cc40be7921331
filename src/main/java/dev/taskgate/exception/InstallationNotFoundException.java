package dev.taskgate.exception;

import java.util.UUID;

/** Tenant not provisioned for the platform, or its installation was deactivated. */
public class InstallationNotFoundException extends RuntimeException {

    public InstallationNotFoundException(String platform, String organizationId) {
        super("No active %s installation for organization %s".formatted(platform, organizationId));
    }

    public InstallationNotFoundException(UUID installationId) {
        super("Installation not found: " + installationId);
    }
}
