package com.tessera.multitenancy;

import java.util.Optional;

/**
 * Gives access to the unit of work active on the calling thread, if any.
 */
public interface UnitOfWorkManager {

    Optional<UnitOfWork> current();
}
