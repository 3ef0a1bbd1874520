package com.tessera.identity.authorization;

import com.tessera.identity.cache.UserPermissionCache;
import com.tessera.identity.cache.UserPermissionCacheItem;
import com.tessera.identity.permission.FeatureChecker;
import com.tessera.identity.permission.FeatureDependencyContext;
import com.tessera.identity.permission.Permission;
import com.tessera.identity.permission.PermissionCatalog;
import com.tessera.identity.role.RoleManager;
import com.tessera.identity.user.UserIdentity;
import com.tessera.multitenancy.MultiTenancySide;
import com.tessera.multitenancy.TenantContext;
import com.tessera.multitenancy.TenantContextResolver;
import com.tessera.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a user is granted a permission.
 *
 * <p>Evaluation order, first match wins:
 * <ol>
 *   <li>the permission is not available on the current side: denied</li>
 *   <li>tenant side and the tenant lacks a required feature: denied</li>
 *   <li>the user does not exist: denied</li>
 *   <li>explicitly granted to the user: granted</li>
 *   <li>explicitly prohibited for the user: denied, even when a role grants it</li>
 *   <li>any of the user's roles grants it: granted</li>
 *   <li>otherwise denied</li>
 * </ol>
 *
 * <p>Methods without a {@link TenantContext} parameter resolve it once and use that value for
 * every step of the call.
 */
public class PermissionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PermissionEvaluator.class);

    private final PermissionCatalog permissionCatalog;
    private final UserPermissionCache permissionCache;
    private final RoleManager roleManager;
    private final FeatureChecker featureChecker;
    private final TenantContextResolver tenantContextResolver;
    private final Counter grantedChecks;
    private final Counter deniedChecks;
    private final Timer evaluationTimer;

    public PermissionEvaluator(
            PermissionCatalog permissionCatalog,
            UserPermissionCache permissionCache,
            RoleManager roleManager,
            FeatureChecker featureChecker,
            TenantContextResolver tenantContextResolver,
            MetricFactory metrics) {
        this.permissionCatalog = permissionCatalog;
        this.permissionCache = permissionCache;
        this.roleManager = roleManager;
        this.featureChecker = featureChecker;
        this.tenantContextResolver = tenantContextResolver;
        this.grantedChecks = metrics.counter("permission.checks", "Permission evaluations", "outcome", "granted");
        this.deniedChecks = metrics.counter("permission.checks", "Permission evaluations", "outcome", "denied");
        this.evaluationTimer = metrics.timer("permission.evaluation", "Time spent evaluating a permission");
    }

    /**
     * Checks a permission by name in the current tenant context.
     *
     * @throws com.tessera.identity.EntityNotFoundException if the permission is not defined
     */
    public boolean isGranted(long userId, String permissionName) {
        return isGranted(userId, permissionCatalog.getPermission(permissionName));
    }

    /** Checks a permission for a user in the current tenant context. */
    public boolean isGranted(UserIdentity user, Permission permission) {
        return isGranted(user.id(), permission);
    }

    /** Checks a permission for a user id in the current tenant context. */
    public boolean isGranted(long userId, Permission permission) {
        return isGranted(tenantContextResolver.resolve(), userId, permission);
    }

    /**
     * Checks a permission for a user in an explicit tenant context.
     *
     * @param context    the tenant context used for every step
     * @param userId     the user
     * @param permission the permission
     * @return true when granted
     */
    public boolean isGranted(TenantContext context, long userId, Permission permission) {
        boolean granted = evaluationTimer.record(() -> evaluate(context, userId, permission));
        (granted ? grantedChecks : deniedChecks).increment();
        return granted;
    }

    /** Every catalog permission granted to the user in the current tenant context. */
    public List<Permission> getGrantedPermissions(UserIdentity user) {
        return getGrantedPermissions(tenantContextResolver.resolve(), user.id());
    }

    /** Every catalog permission granted to the user in an explicit tenant context. */
    public List<Permission> getGrantedPermissions(TenantContext context, long userId) {
        List<Permission> granted = new ArrayList<>();
        for (Permission permission : permissionCatalog.getAllPermissions()) {
            if (isGranted(context, userId, permission)) {
                granted.add(permission);
            }
        }
        return granted;
    }

    /** The cached permission snapshot of the user, empty if the user does not exist. */
    public Optional<UserPermissionCacheItem> getUserPermissionCacheItem(TenantContext context, long userId) {
        return permissionCache.get(userId, context);
    }

    /** Resolves the tenant context of the current call. */
    public TenantContext currentContext() {
        return tenantContextResolver.resolve();
    }

    /**
     * Evaluates without recording metrics, for re-checks made by the identity services themselves.
     */
    boolean evaluate(TenantContext context, long userId, Permission permission) {
        if (!isAvailable(context, userId, permission)) {
            return false;
        }
        Optional<UserPermissionCacheItem> cacheItem = permissionCache.get(userId, context);
        if (cacheItem.isEmpty()) {
            log.debug("Permission {} denied: user {} not found", permission.name(), userId);
            return false;
        }
        return evaluateSettings(cacheItem.get(), permission);
    }

    /**
     * Evaluates against a snapshot the caller already holds, without recording metrics.
     *
     * @param item the user's snapshot, or null when the user does not exist
     */
    boolean evaluate(TenantContext context, UserPermissionCacheItem item, Permission permission) {
        if (item == null) {
            return false;
        }
        return isAvailable(context, item.userId(), permission) && evaluateSettings(item, permission);
    }

    private boolean isAvailable(TenantContext context, long userId, Permission permission) {
        String name = permission.name();

        if (!permission.isAvailableOn(context.side())) {
            log.debug("Permission {} denied for user {}: not available on side {}", name, userId, context.side());
            return false;
        }

        if (permission.featureDependency() != null && context.side() == MultiTenancySide.TENANT) {
            var dependencyContext = new FeatureDependencyContext(context.tenantId(), featureChecker);
            if (!permission.featureDependency().isSatisfied(dependencyContext)) {
                log.debug("Permission {} denied for user {}: feature dependency not satisfied for tenant {}",
                        name, userId, context.tenantId());
                return false;
            }
        }
        return true;
    }

    private boolean evaluateSettings(UserPermissionCacheItem item, Permission permission) {
        String name = permission.name();
        if (item.isExplicitlyGranted(name)) {
            return true;
        }
        if (item.isExplicitlyProhibited(name)) {
            log.debug("Permission {} prohibited for user {}", name, item.userId());
            return false;
        }

        for (long roleId : item.roleIds()) {
            if (roleManager.isGranted(roleId, permission)) {
                return true;
            }
        }
        return false;
    }
}
