package com.tessera.identity;

/**
 * Thrown at wiring time when a collaborator lacks a capability the identity services need, for
 * example a user store that cannot persist permission settings. This is a configuration error and
 * is never retried.
 */
public class MissingCapabilityException extends IllegalStateException {

    private final Class<?> collaboratorType;
    private final Class<?> requiredCapability;

    public MissingCapabilityException(Class<?> collaboratorType, Class<?> requiredCapability) {
        super("%s does not implement %s".formatted(
                collaboratorType.getName(), requiredCapability.getSimpleName()));
        this.collaboratorType = collaboratorType;
        this.requiredCapability = requiredCapability;
    }

    public Class<?> collaboratorType() {
        return collaboratorType;
    }

    public Class<?> requiredCapability() {
        return requiredCapability;
    }
}
