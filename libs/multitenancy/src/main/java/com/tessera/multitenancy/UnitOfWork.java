package com.tessera.multitenancy;

import java.util.Optional;

/**
 * An active unit of work. Data filters inside it are scoped to its tenant.
 */
public interface UnitOfWork {

    /** The tenant the unit of work is bound to, empty on the host side. */
    Optional<Long> tenantId();
}
