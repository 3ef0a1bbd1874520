package com.tessera.identity.cache;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Snapshot of a user's role memberships and explicit permission settings.
 *
 * @param userId                the user
 * @param roleIds               ids of the roles the user holds
 * @param grantedPermissions    names explicitly granted to the user
 * @param prohibitedPermissions names explicitly prohibited for the user
 */
public record UserPermissionCacheItem(
        long userId,
        Set<Long> roleIds,
        Set<String> grantedPermissions,
        Set<String> prohibitedPermissions) {

    public UserPermissionCacheItem {
        roleIds = immutableCopy(roleIds);
        grantedPermissions = immutableCopy(grantedPermissions);
        prohibitedPermissions = immutableCopy(prohibitedPermissions);
    }

    public boolean isExplicitlyGranted(String permissionName) {
        return grantedPermissions.contains(permissionName);
    }

    public boolean isExplicitlyProhibited(String permissionName) {
        return prohibitedPermissions.contains(permissionName);
    }

    /** A copy of this snapshot without the explicit grant of the permission. */
    public UserPermissionCacheItem withoutGrant(String permissionName) {
        Set<String> granted = new LinkedHashSet<>(grantedPermissions);
        granted.remove(permissionName);
        return new UserPermissionCacheItem(userId, roleIds, granted, prohibitedPermissions);
    }

    /** A copy of this snapshot without the explicit prohibition of the permission. */
    public UserPermissionCacheItem withoutProhibition(String permissionName) {
        Set<String> prohibited = new LinkedHashSet<>(prohibitedPermissions);
        prohibited.remove(permissionName);
        return new UserPermissionCacheItem(userId, roleIds, grantedPermissions, prohibited);
    }

    private static <T> Set<T> immutableCopy(Set<T> source) {
        return source == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }
}
