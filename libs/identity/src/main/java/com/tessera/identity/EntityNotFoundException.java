package com.tessera.identity;

/**
 * Thrown when an operation requires a user, role, permission or organization unit that does not
 * exist.
 */
public class EntityNotFoundException extends RuntimeException {

    private final String entityType;
    private final Object id;

    public EntityNotFoundException(String entityType, Object id) {
        super("There is no %s with id: %s".formatted(entityType, id));
        this.entityType = entityType;
        this.id = id;
    }

    /** The kind of entity that was looked up (e.g., "User", "Permission"). */
    public String entityType() {
        return entityType;
    }

    /** The identifier or name used for the lookup. */
    public Object id() {
        return id;
    }
}
