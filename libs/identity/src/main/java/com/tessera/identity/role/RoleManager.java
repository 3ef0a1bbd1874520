package com.tessera.identity.role;

import com.tessera.identity.EntityNotFoundException;
import com.tessera.identity.permission.Permission;
import java.util.Optional;

/**
 * Role lookups and role-level permission grants.
 */
public interface RoleManager {

    Optional<RoleIdentity> findById(long roleId);

    /**
     * Finds a role by name within a tenant. Role names are unique per tenant only.
     *
     * @param tenantId the owning tenant, null for host roles
     * @param roleName the role name
     */
    Optional<RoleIdentity> findByName(Long tenantId, String roleName);

    /**
     * Whether the role grants the permission.
     *
     * @param roleId     the role
     * @param permission the permission to check
     */
    boolean isGranted(long roleId, Permission permission);

    /**
     * Gets a role by name within a tenant.
     *
     * @param tenantId the owning tenant, null for host roles
     * @param roleName the role name
     * @throws EntityNotFoundException if the tenant has no role with that name
     */
    default RoleIdentity getRoleByName(Long tenantId, String roleName) {
        return findByName(tenantId, roleName).orElseThrow(() -> new EntityNotFoundException("Role", roleName));
    }
}
