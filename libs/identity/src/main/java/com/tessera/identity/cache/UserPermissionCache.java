package com.tessera.identity.cache;

import com.tessera.identity.permission.PermissionGrantInfo;
import com.tessera.identity.permission.PermissionStore;
import com.tessera.identity.role.RoleManager;
import com.tessera.identity.user.UserIdentity;
import com.tessera.identity.user.UserStore;
import com.tessera.multitenancy.TenantContext;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-user permission snapshots keyed by {@code userId@tenantId}.
 *
 * <p>On a miss the snapshot is built from the user store (role names mapped to role ids of the
 * user's tenant through the {@link RoleManager}) and the permission store (settings split by
 * polarity). Loads are single-flight per key. A user that does not exist, or that belongs to a
 * different tenant than the context, produces no snapshot and nothing is cached.
 */
public class UserPermissionCache {

    private static final Logger log = LoggerFactory.getLogger(UserPermissionCache.class);

    private static final String KEY_SEPARATOR = "@";

    private final SingleFlightCache<String, UserPermissionCacheItem> cache;
    private final UserStore userStore;
    private final PermissionStore permissionStore;
    private final RoleManager roleManager;

    /**
     * @param cache       backing single-flight cache
     * @param userStore   user store; must also implement {@link PermissionStore}
     * @param roleManager maps role names to role ids
     * @throws com.tessera.identity.MissingCapabilityException if the user store cannot persist
     *     permission settings
     */
    public UserPermissionCache(
            SingleFlightCache<String, UserPermissionCacheItem> cache,
            UserStore userStore,
            RoleManager roleManager) {
        this.permissionStore = PermissionStore.requireFrom(userStore);
        this.cache = cache;
        this.userStore = userStore;
        this.roleManager = roleManager;
    }

    /**
     * Builds the cache key of a user within a tenant context.
     *
     * @return {@code userId@tenantId}, with tenant id 0 when no tenant is bound
     */
    public static String cacheKey(long userId, TenantContext context) {
        return userId + KEY_SEPARATOR + context.tenantIdOrDefault();
    }

    /**
     * Returns the user's snapshot for the context, loading it on a miss.
     *
     * @return the snapshot, or empty when the user does not exist in the context's tenant
     */
    public Optional<UserPermissionCacheItem> get(long userId, TenantContext context) {
        return Optional.ofNullable(cache.get(cacheKey(userId, context), key -> load(userId, context)));
    }

    /** Evicts the user's snapshots for every tenant context. */
    public void invalidate(long userId) {
        String prefix = userId + KEY_SEPARATOR;
        cache.invalidateIf(key -> key.startsWith(prefix));
        log.debug("Invalidated permission cache of user {}", userId);
    }

    /** Evicts every snapshot. */
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated the whole permission cache");
    }

    private UserPermissionCacheItem load(long userId, TenantContext context) {
        Optional<UserIdentity> user = userStore.findById(userId);
        if (user.isEmpty()) {
            log.debug("No user {}; permission snapshot not created", userId);
            return null;
        }
        Long tenantId = user.get().tenantId();
        if (!Objects.equals(tenantId, context.tenantId())) {
            log.debug("User {} of tenant {} is not visible in tenant {}; permission snapshot not created",
                    userId, tenantId, context.tenantId());
            return null;
        }

        Set<Long> roleIds = new LinkedHashSet<>();
        for (String roleName : userStore.getRoleNames(userId)) {
            roleIds.add(roleManager.getRoleByName(tenantId, roleName).id());
        }

        Set<String> granted = new LinkedHashSet<>();
        Set<String> prohibited = new LinkedHashSet<>();
        for (PermissionGrantInfo setting : permissionStore.getPermissions(userId)) {
            if (setting.granted()) {
                granted.add(setting.name());
            } else {
                prohibited.add(setting.name());
            }
        }

        log.debug("Loaded permission snapshot of user {}: {} roles, {} granted, {} prohibited",
                userId, roleIds.size(), granted.size(), prohibited.size());
        return new UserPermissionCacheItem(userId, roleIds, granted, prohibited);
    }
}
