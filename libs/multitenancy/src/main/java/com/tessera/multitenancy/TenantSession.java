package com.tessera.multitenancy;

import java.util.Optional;

/**
 * Tenant information of the authenticated caller's session.
 */
public interface TenantSession {

    /** The session tenant, empty for host users. */
    Optional<Long> tenantId();

    /** The side the session operates on. */
    MultiTenancySide multiTenancySide();
}
