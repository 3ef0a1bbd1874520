package com.tessera.identity.authorization;

import com.tessera.identity.cache.UserPermissionCache;
import com.tessera.identity.cache.UserPermissionCacheItem;
import com.tessera.identity.permission.Permission;
import com.tessera.identity.permission.PermissionCatalog;
import com.tessera.identity.permission.PermissionGrantInfo;
import com.tessera.identity.permission.PermissionStore;
import com.tessera.identity.user.UserIdentity;
import com.tessera.identity.user.UserStore;
import com.tessera.multitenancy.TenantContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies user-specific permission overrides and keeps the permission cache in step with the
 * store.
 *
 * <p>Every store write is followed by an eviction of the user's cached snapshot, so the next
 * evaluation observes the write. A grant and a prohibition for the same permission never coexist:
 * the opposite setting is removed before a new one is stored. A setting is only stored when it
 * changes the effective result, so a permission a role already grants gets no user-level grant.
 *
 * <p>Re-checks made here do not count as permission checks in the metrics. The bulk operations
 * evaluate every permission against one snapshot and evict the user's cache once at the end. A
 * permission's outcome depends only on its own settings and the user's roles.
 *
 * <p>{@link #resetAllPermissions(UserIdentity)} and {@link #prohibitAllPermissions(UserIdentity)}
 * are different operations: the first removes every override (role grants apply again), the
 * second stores a prohibition for every granted permission.
 */
public class UserPermissionManager {

    private static final Logger log = LoggerFactory.getLogger(UserPermissionManager.class);

    private final PermissionStore permissionStore;
    private final PermissionCatalog permissionCatalog;
    private final PermissionEvaluator evaluator;
    private final UserPermissionCache permissionCache;

    /**
     * @throws com.tessera.identity.MissingCapabilityException if the user store cannot persist
     *     permission settings
     */
    public UserPermissionManager(
            UserStore userStore,
            PermissionCatalog permissionCatalog,
            PermissionEvaluator evaluator,
            UserPermissionCache permissionCache) {
        this.permissionStore = PermissionStore.requireFrom(userStore);
        this.permissionCatalog = permissionCatalog;
        this.evaluator = evaluator;
        this.permissionCache = permissionCache;
    }

    /** Grants a permission in the current tenant context. */
    public void grantPermission(UserIdentity user, Permission permission) {
        grantPermission(evaluator.currentContext(), user, permission);
    }

    /**
     * Removes any prohibition of the permission and stores a grant unless the permission is
     * already granted.
     */
    public void grantPermission(TenantContext context, UserIdentity user, Permission permission) {
        removeSetting(user, PermissionGrantInfo.prohibited(permission.name()));

        if (evaluator.evaluate(context, user.id(), permission)) {
            log.debug("Permission {} already granted to user {}", permission.name(), user.id());
            return;
        }

        addSetting(user, PermissionGrantInfo.granted(permission.name()));
        log.info("Granted permission {} to user {}", permission.name(), user.id());
    }

    /** Prohibits a permission in the current tenant context. */
    public void prohibitPermission(UserIdentity user, Permission permission) {
        prohibitPermission(evaluator.currentContext(), user, permission);
    }

    /**
     * Removes any explicit grant of the permission and stores a prohibition if the permission is
     * still granted (for example through a role).
     */
    public void prohibitPermission(TenantContext context, UserIdentity user, Permission permission) {
        removeSetting(user, PermissionGrantInfo.granted(permission.name()));

        if (!evaluator.evaluate(context, user.id(), permission)) {
            log.debug("Permission {} already denied for user {}", permission.name(), user.id());
            return;
        }

        addSetting(user, PermissionGrantInfo.prohibited(permission.name()));
        log.info("Prohibited permission {} for user {}", permission.name(), user.id());
    }

    /**
     * Removes every user-specific setting. The user keeps exactly the permissions their roles
     * grant.
     */
    public void resetAllPermissions(UserIdentity user) {
        permissionStore.removeAllPermissionSettings(user.id());
        permissionCache.invalidate(user.id());
        log.info("Reset all permission settings of user {}", user.id());
    }

    /** Prohibits every catalog permission in the current tenant context. */
    public void prohibitAllPermissions(UserIdentity user) {
        prohibitAllPermissions(evaluator.currentContext(), user);
    }

    /** Prohibits every catalog permission in an explicit tenant context. */
    public void prohibitAllPermissions(TenantContext context, UserIdentity user) {
        UserPermissionCacheItem snapshot = snapshot(context, user);
        try {
            for (Permission permission : permissionCatalog.getAllPermissions()) {
                prohibit(context, user, permission, snapshot);
            }
        } finally {
            permissionCache.invalidate(user.id());
        }
        log.info("Prohibited all permissions for user {}", user.id());
    }

    /** Sets the user's granted permissions in the current tenant context. */
    public void setGrantedPermissions(UserIdentity user, Collection<Permission> permissions) {
        setGrantedPermissions(evaluator.currentContext(), user, permissions);
    }

    /**
     * Makes the user's granted permissions exactly the given set: currently granted permissions
     * missing from it are prohibited, the others are granted.
     */
    public void setGrantedPermissions(
            TenantContext context, UserIdentity user, Collection<Permission> permissions) {
        UserPermissionCacheItem snapshot = snapshot(context, user);
        List<Permission> current = new ArrayList<>();
        for (Permission permission : permissionCatalog.getAllPermissions()) {
            if (evaluator.evaluate(context, snapshot, permission)) {
                current.add(permission);
            }
        }
        Set<String> currentNames = names(current);
        Set<Permission> target = new LinkedHashSet<>(permissions);
        Set<String> targetNames = names(target);

        try {
            for (Permission permission : current) {
                if (!targetNames.contains(permission.name())) {
                    prohibit(context, user, permission, snapshot);
                }
            }
            for (Permission permission : target) {
                if (!currentNames.contains(permission.name())) {
                    grant(context, user, permission, snapshot);
                }
            }
        } finally {
            permissionCache.invalidate(user.id());
        }
        log.info("Set granted permissions of user {} to {}", user.id(), targetNames);
    }

    private UserPermissionCacheItem snapshot(TenantContext context, UserIdentity user) {
        return permissionCache.get(user.id(), context).orElse(null);
    }

    private void grant(
            TenantContext context, UserIdentity user, Permission permission, UserPermissionCacheItem snapshot) {
        String name = permission.name();
        permissionStore.removePermission(user.id(), PermissionGrantInfo.prohibited(name));
        UserPermissionCacheItem withoutProhibition = snapshot == null ? null : snapshot.withoutProhibition(name);
        if (!evaluator.evaluate(context, withoutProhibition, permission)) {
            permissionStore.addPermission(user.id(), PermissionGrantInfo.granted(name));
        }
    }

    private void prohibit(
            TenantContext context, UserIdentity user, Permission permission, UserPermissionCacheItem snapshot) {
        String name = permission.name();
        permissionStore.removePermission(user.id(), PermissionGrantInfo.granted(name));
        UserPermissionCacheItem withoutGrant = snapshot == null ? null : snapshot.withoutGrant(name);
        if (evaluator.evaluate(context, withoutGrant, permission)) {
            permissionStore.addPermission(user.id(), PermissionGrantInfo.prohibited(name));
        }
    }

    private void removeSetting(UserIdentity user, PermissionGrantInfo setting) {
        permissionStore.removePermission(user.id(), setting);
        permissionCache.invalidate(user.id());
    }

    private void addSetting(UserIdentity user, PermissionGrantInfo setting) {
        permissionStore.addPermission(user.id(), setting);
        permissionCache.invalidate(user.id());
    }

    private static Set<String> names(Collection<Permission> permissions) {
        return permissions.stream().map(Permission::name).collect(Collectors.toSet());
    }
}
