package com.tessera.identity.role;

import com.tessera.identity.IdentityResult;
import com.tessera.identity.cache.UserPermissionCache;
import com.tessera.identity.user.UserIdentity;
import com.tessera.identity.user.UserStore;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles a user's roles with a target list of role names.
 *
 * <p>Roles not in the target are removed first, then missing target roles are added. The first
 * failed add or remove is returned as is and nothing further is changed. Changes made before the
 * failure are kept: each step is atomic, the whole operation is not.
 */
public class RoleSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(RoleSynchronizer.class);

    private final UserStore userStore;
    private final RoleManager roleManager;
    private final UserPermissionCache permissionCache;

    public RoleSynchronizer(UserStore userStore, RoleManager roleManager, UserPermissionCache permissionCache) {
        this.userStore = userStore;
        this.roleManager = roleManager;
        this.permissionCache = permissionCache;
    }

    /**
     * Sets the user's roles to exactly the given names.
     *
     * @param user            the user
     * @param targetRoleNames the roles the user should hold; null means none
     * @return success, or the first failed result
     * @throws com.tessera.identity.EntityNotFoundException if a target role does not exist in the
     *     user's tenant
     */
    public IdentityResult setRoles(UserIdentity user, Collection<String> targetRoleNames) {
        Set<String> target = targetRoleNames == null ? Set.of() : new LinkedHashSet<>(targetRoleNames);
        List<String> current = userStore.getRoleNames(user.id());
        boolean changed = false;

        try {
            for (String roleName : current) {
                if (!target.contains(roleName)) {
                    IdentityResult result = userStore.removeFromRole(user, roleName);
                    if (!result.succeeded()) {
                        log.warn("Removing user {} from role {} failed: {}", user.id(), roleName, result.errors());
                        return result;
                    }
                    changed = true;
                }
            }

            for (String roleName : target) {
                RoleIdentity role = roleManager.getRoleByName(user.tenantId(), roleName);
                if (!current.contains(role.name())) {
                    IdentityResult result = userStore.addToRole(user, role.name());
                    if (!result.succeeded()) {
                        log.warn("Adding user {} to role {} failed: {}", user.id(), roleName, result.errors());
                        return result;
                    }
                    changed = true;
                }
            }
        } finally {
            if (changed) {
                permissionCache.invalidate(user.id());
            }
        }

        log.info("Roles of user {} set to {}", user.id(), target);
        return IdentityResult.success();
    }
}
