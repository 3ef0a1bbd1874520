package com.tessera.identity.permission;

import com.tessera.identity.EntityNotFoundException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the permissions defined by the application.
 */
public interface PermissionCatalog {

    Optional<Permission> findPermission(String name);

    /** Every defined permission, in definition order. */
    List<Permission> getAllPermissions();

    /**
     * Gets a permission by name.
     *
     * @throws EntityNotFoundException if no permission has that name
     */
    default Permission getPermission(String name) {
        return findPermission(name).orElseThrow(() -> new EntityNotFoundException("Permission", name));
    }
}
