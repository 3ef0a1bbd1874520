package com.tessera.identity.user;

/**
 * The parts of a user account the identity services depend on.
 */
public interface UserIdentity {

    long id();

    /** The owning tenant, null for host users. */
    Long tenantId();

    String userName();

    String emailAddress();
}
