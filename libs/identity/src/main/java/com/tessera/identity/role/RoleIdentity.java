package com.tessera.identity.role;

/**
 * The parts of a role the identity services depend on.
 */
public interface RoleIdentity {

    long id();

    /** The owning tenant, null for host roles. */
    Long tenantId();

    String name();
}
