package com.tessera.identity.config;

import com.tessera.identity.authorization.PermissionEvaluator;
import com.tessera.identity.authorization.UserPermissionManager;
import com.tessera.identity.cache.SingleFlightCache;
import com.tessera.identity.cache.UserPermissionCache;
import com.tessera.identity.cache.UserPermissionCacheItem;
import com.tessera.identity.organization.OrganizationUnitMembershipManager;
import com.tessera.identity.organization.OrganizationUnitRepository;
import com.tessera.identity.organization.OrganizationUnitSettings;
import com.tessera.identity.organization.SettingOrganizationUnitSettings;
import com.tessera.identity.organization.UserOrganizationUnitRepository;
import com.tessera.identity.permission.FeatureChecker;
import com.tessera.identity.permission.PermissionCatalog;
import com.tessera.identity.role.RoleManager;
import com.tessera.identity.role.RoleSynchronizer;
import com.tessera.identity.settings.SettingProvider;
import com.tessera.identity.user.PasswordValidator;
import com.tessera.identity.user.UserManager;
import com.tessera.identity.user.UserStore;
import com.tessera.multitenancy.TenantContextResolver;
import com.tessera.multitenancy.TenantSession;
import com.tessera.multitenancy.UnitOfWorkManager;
import com.tessera.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the identity services from the collaborator beans of the hosting application.
 *
 * <p>The application provides: {@link UserStore} (which must also implement
 * {@link com.tessera.identity.permission.PermissionStore}), {@link RoleManager},
 * {@link PermissionCatalog}, {@link FeatureChecker}, {@link UnitOfWorkManager},
 * {@link TenantSession}, {@link OrganizationUnitRepository},
 * {@link UserOrganizationUnitRepository} and {@link SettingProvider}. A {@link MeterRegistry} and
 * {@link PasswordValidator} beans are optional.
 *
 * <p>Startup fails with {@link com.tessera.identity.MissingCapabilityException} when the user
 * store cannot persist permission settings.
 */
@Configuration
@EnableConfigurationProperties(IdentityProperties.class)
public class IdentityConfiguration {

    /** Name of the permission snapshot cache, used as its metric tag. */
    public static final String PERMISSION_CACHE_NAME = "user-permissions";

    @Bean
    @ConditionalOnMissingBean
    public TenantContextResolver tenantContextResolver(
            UnitOfWorkManager unitOfWorkManager, TenantSession tenantSession, IdentityProperties properties) {
        return new TenantContextResolver(unitOfWorkManager, tenantSession, properties.multiTenancyEnabled());
    }

    @Bean
    public UserPermissionCache userPermissionCache(
            UserStore userStore,
            RoleManager roleManager,
            IdentityProperties properties,
            ObjectProvider<MeterRegistry> meterRegistry) {
        IdentityProperties.PermissionCache cacheProperties = properties.permissionCache();
        SingleFlightCache<String, UserPermissionCacheItem> cache = new SingleFlightCache<>(
                PERMISSION_CACHE_NAME,
                cacheProperties.ttl(),
                cacheProperties.maximumSize(),
                metrics(meterRegistry, "permission-cache"));
        return new UserPermissionCache(cache, userStore, roleManager);
    }

    @Bean
    public PermissionEvaluator permissionEvaluator(
            PermissionCatalog permissionCatalog,
            UserPermissionCache userPermissionCache,
            RoleManager roleManager,
            FeatureChecker featureChecker,
            TenantContextResolver tenantContextResolver,
            ObjectProvider<MeterRegistry> meterRegistry) {
        return new PermissionEvaluator(
                permissionCatalog,
                userPermissionCache,
                roleManager,
                featureChecker,
                tenantContextResolver,
                metrics(meterRegistry, "permission-evaluator"));
    }

    @Bean
    public UserPermissionManager userPermissionManager(
            UserStore userStore,
            PermissionCatalog permissionCatalog,
            PermissionEvaluator permissionEvaluator,
            UserPermissionCache userPermissionCache) {
        return new UserPermissionManager(userStore, permissionCatalog, permissionEvaluator, userPermissionCache);
    }

    @Bean
    public RoleSynchronizer roleSynchronizer(
            UserStore userStore, RoleManager roleManager, UserPermissionCache userPermissionCache) {
        return new RoleSynchronizer(userStore, roleManager, userPermissionCache);
    }

    @Bean
    @ConditionalOnMissingBean
    public OrganizationUnitSettings organizationUnitSettings(
            SettingProvider settingProvider, IdentityProperties properties) {
        return new SettingOrganizationUnitSettings(
                settingProvider, properties.organizationUnits().maxUserMembershipCount());
    }

    @Bean
    public OrganizationUnitMembershipManager organizationUnitMembershipManager(
            UserStore userStore,
            OrganizationUnitRepository organizationUnitRepository,
            UserOrganizationUnitRepository userOrganizationUnitRepository,
            OrganizationUnitSettings organizationUnitSettings,
            ObjectProvider<MeterRegistry> meterRegistry) {
        return new OrganizationUnitMembershipManager(
                userStore,
                organizationUnitRepository,
                userOrganizationUnitRepository,
                organizationUnitSettings,
                metrics(meterRegistry, "organization-units"));
    }

    @Bean
    public UserManager userManager(
            UserStore userStore,
            ObjectProvider<PasswordValidator> passwordValidators,
            IdentityProperties properties) {
        return new UserManager(
                userStore, passwordValidators.orderedStream().toList(), properties.adminUserName());
    }

    private static MetricFactory metrics(ObjectProvider<MeterRegistry> meterRegistry, String component) {
        return new MetricFactory(meterRegistry.getIfAvailable(SimpleMeterRegistry::new), component);
    }
}
