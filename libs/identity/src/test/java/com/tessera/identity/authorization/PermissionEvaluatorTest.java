package com.tessera.identity.authorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.identity.EntityNotFoundException;
import com.tessera.identity.cache.SingleFlightCache;
import com.tessera.identity.cache.UserPermissionCache;
import com.tessera.identity.permission.DefaultPermissionCatalog;
import com.tessera.identity.permission.Permission;
import com.tessera.identity.permission.PermissionGrantInfo;
import com.tessera.identity.permission.SimpleFeatureDependency;
import com.tessera.identity.testing.InMemoryFeatureChecker;
import com.tessera.identity.testing.InMemoryRoleManager;
import com.tessera.identity.testing.InMemoryUserStore;
import com.tessera.identity.testing.TestUser;
import com.tessera.multitenancy.MultiTenancySide;
import com.tessera.multitenancy.TenantContext;
import com.tessera.multitenancy.TenantContextResolver;
import com.tessera.multitenancy.testing.FixedTenantSession;
import com.tessera.multitenancy.testing.ThreadLocalUnitOfWorkManager;
import com.tessera.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PermissionEvaluator")
class PermissionEvaluatorTest {

    private static final Permission ORDERS_CREATE = Permission.of("Orders.Create");
    private static final Permission ORDERS_APPROVE = Permission.of("Orders.Approve", MultiTenancySide.TENANT)
            .withFeatureDependency(SimpleFeatureDependency.anyOf("Orders"));
    private static final Permission TENANTS_MANAGE = Permission.of("Tenants.Manage", MultiTenancySide.HOST);
    private static final Permission REPORTS_VIEW = Permission.of("Reports.View");

    private InMemoryUserStore userStore;
    private InMemoryRoleManager roleManager;
    private InMemoryFeatureChecker featureChecker;
    private ThreadLocalUnitOfWorkManager unitOfWorkManager;
    private SimpleMeterRegistry registry;
    private PermissionEvaluator evaluator;

    private final TestUser alice = TestUser.of(1, 5L, "alice");

    @BeforeEach
    void setUp() {
        userStore = new InMemoryUserStore();
        roleManager = new InMemoryRoleManager();
        featureChecker = new InMemoryFeatureChecker().enable(5, "Orders");
        unitOfWorkManager = new ThreadLocalUnitOfWorkManager();
        registry = new SimpleMeterRegistry();

        var cache = new UserPermissionCache(
                new SingleFlightCache<>("user-permissions", Duration.ofMinutes(5), 100,
                        new MetricFactory(registry, "permission-cache")),
                userStore,
                roleManager);
        evaluator = new PermissionEvaluator(
                DefaultPermissionCatalog.of(ORDERS_CREATE, ORDERS_APPROVE, TENANTS_MANAGE, REPORTS_VIEW),
                cache,
                roleManager,
                featureChecker,
                new TenantContextResolver(unitOfWorkManager, FixedTenantSession.host(), true),
                new MetricFactory(registry, "permission-evaluator"));

        roleManager.addRole(5L, "Manager", "Orders.Approve", "Orders.Create");
        userStore.addUser(alice, "Manager");
    }

    @Nested
    @DisplayName("Multi-tenancy side")
    class Side {

        @Test
        @DisplayName("a host-only permission is denied on the tenant side even when explicitly granted")
        void hostOnlyOnTenantSide() {
            var root = TestUser.of(9, null, "root");
            userStore.addUser(root);
            userStore.addPermission(alice.id(), PermissionGrantInfo.granted("Tenants.Manage"));
            userStore.addPermission(root.id(), PermissionGrantInfo.granted("Tenants.Manage"));

            assertThat(evaluator.isGranted(TenantContext.tenant(5), alice.id(), TENANTS_MANAGE)).isFalse();
            assertThat(evaluator.isGranted(TenantContext.host(), root.id(), TENANTS_MANAGE)).isTrue();
        }

        @Test
        @DisplayName("Orders.Approve is granted in tenant 5 through Manager and denied on the host side")
        void ordersApproveScenario() {
            try (var ignored = unitOfWorkManager.begin(5L)) {
                assertThat(evaluator.isGranted(alice.id(), "Orders.Approve")).isTrue();
            }
            try (var ignored = unitOfWorkManager.begin(null)) {
                assertThat(evaluator.isGranted(alice.id(), "Orders.Approve")).isFalse();
            }
        }
    }

    @Nested
    @DisplayName("Feature dependency")
    class Features {

        @Test
        @DisplayName("denies on the tenant side when the tenant lacks the feature")
        void featureDisabled() {
            featureChecker.disable(5, "Orders");

            assertThat(evaluator.isGranted(TenantContext.tenant(5), alice.id(), ORDERS_APPROVE)).isFalse();
        }

        @Test
        @DisplayName("checks the feature against the context tenant")
        void featureOfOtherTenant() {
            var dave = TestUser.of(4, 6L, "dave");
            roleManager.addRole(6L, "Manager", "Orders.Approve");
            userStore.addUser(dave, "Manager");

            assertThat(evaluator.isGranted(TenantContext.tenant(5), alice.id(), ORDERS_APPROVE)).isTrue();
            assertThat(evaluator.isGranted(TenantContext.tenant(6), dave.id(), ORDERS_APPROVE)).isFalse();

            featureChecker.enable(6, "Orders");

            assertThat(evaluator.isGranted(TenantContext.tenant(6), dave.id(), ORDERS_APPROVE)).isTrue();
        }

        @Test
        @DisplayName("passes a null tenant to the feature checker when no tenant is bound")
        void singleTenantDeployment() {
            var erin = TestUser.of(5, null, "erin");
            roleManager.addRole("Manager", "Orders.Approve");
            userStore.addUser(erin, "Manager");
            var noTenant = new TenantContext(null, MultiTenancySide.TENANT);
            assertThat(evaluator.isGranted(noTenant, erin.id(), ORDERS_APPROVE)).isFalse();

            featureChecker.enableForHost("Orders");

            assertThat(evaluator.isGranted(noTenant, erin.id(), ORDERS_APPROVE)).isTrue();
        }

        @Test
        @DisplayName("does not check features on the host side")
        void hostSideSkipsFeatureCheck() {
            var root = TestUser.of(9, null, "root");
            userStore.addUser(root);
            var hostPermission = Permission.of("Audit.Read").withFeatureDependency(SimpleFeatureDependency.allOf("Audit"));
            userStore.addPermission(root.id(), PermissionGrantInfo.granted("Audit.Read"));

            assertThat(evaluator.isGranted(TenantContext.host(), root.id(), hostPermission)).isTrue();
        }
    }

    @Nested
    @DisplayName("Precedence")
    class Precedence {

        @Test
        @DisplayName("an explicit grant applies without any role")
        void explicitGrantWithoutRoles() {
            var bob = TestUser.of(2, 5L, "bob");
            userStore.addUser(bob);
            userStore.addPermission(bob.id(), PermissionGrantInfo.granted("Reports.View"));

            assertThat(evaluator.isGranted(TenantContext.tenant(5), bob.id(), REPORTS_VIEW)).isTrue();
        }

        @Test
        @DisplayName("an explicit prohibition beats a role grant")
        void prohibitionBeatsRole() {
            userStore.addPermission(alice.id(), PermissionGrantInfo.prohibited("Orders.Create"));

            assertThat(evaluator.isGranted(TenantContext.tenant(5), alice.id(), ORDERS_CREATE)).isFalse();
        }

        @Test
        @DisplayName("role grants apply when the user has no setting")
        void roleGrant() {
            assertThat(evaluator.isGranted(TenantContext.tenant(5), alice.id(), ORDERS_CREATE)).isTrue();
        }

        @Test
        @DisplayName("denies by default")
        void defaultDeny() {
            assertThat(evaluator.isGranted(TenantContext.tenant(5), alice.id(), REPORTS_VIEW)).isFalse();
        }

        @Test
        @DisplayName("denies for a user that does not exist")
        void missingUser() {
            assertThat(evaluator.isGranted(TenantContext.tenant(5), 404, ORDERS_CREATE)).isFalse();
        }
    }

    @Nested
    @DisplayName("Tenant isolation")
    class TenantIsolation {

        @Test
        @DisplayName("a user of tenant 5 gets nothing in a tenant 7 context")
        void userOfOtherTenant() {
            featureChecker.enable(7, "Orders");
            userStore.addPermission(alice.id(), PermissionGrantInfo.granted("Reports.View"));

            assertThat(evaluator.isGranted(TenantContext.tenant(7), alice.id(), ORDERS_APPROVE)).isFalse();
            assertThat(evaluator.isGranted(TenantContext.tenant(7), alice.id(), REPORTS_VIEW)).isFalse();
            assertThat(evaluator.getUserPermissionCacheItem(TenantContext.tenant(7), alice.id())).isEmpty();
            assertThat(evaluator.isGranted(TenantContext.tenant(5), alice.id(), REPORTS_VIEW)).isTrue();
        }

        @Test
        @DisplayName("a tenant user gets nothing on the host side")
        void tenantUserOnHost() {
            userStore.addPermission(alice.id(), PermissionGrantInfo.granted("Reports.View"));

            assertThat(evaluator.isGranted(TenantContext.host(), alice.id(), REPORTS_VIEW)).isFalse();
        }

        @Test
        @DisplayName("a role name reused by another tenant resolves to the user's tenant role")
        void sameRoleNameInTwoTenants() {
            var frank = TestUser.of(6, 8L, "frank");
            roleManager.addRole(7L, "Supervisor");
            roleManager.addRole(8L, "Supervisor", "Orders.Create");
            roleManager.addRole(9L, "Supervisor");
            userStore.addUser(frank, "Supervisor");

            assertThat(evaluator.isGranted(TenantContext.tenant(8), frank.id(), ORDERS_CREATE)).isTrue();
        }

        @Test
        @DisplayName("a role defined only in another tenant is not found")
        void roleOfOtherTenant() {
            var grace = TestUser.of(7, 8L, "grace");
            userStore.addUser(grace, "Manager");

            assertThatThrownBy(() -> evaluator.isGranted(TenantContext.tenant(8), grace.id(), ORDERS_CREATE))
                    .isInstanceOf(EntityNotFoundException.class)
                    .hasMessageContaining("Manager");
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("an unknown permission name is not found")
        void unknownName() {
            assertThatThrownBy(() -> evaluator.isGranted(alice.id(), "Nope"))
                    .isInstanceOf(EntityNotFoundException.class)
                    .hasMessageContaining("Nope");
        }

        @Test
        @DisplayName("getGrantedPermissions walks the whole catalog")
        void grantedPermissions() {
            try (var ignored = unitOfWorkManager.begin(5L)) {
                assertThat(evaluator.getGrantedPermissions(alice))
                        .containsExactly(ORDERS_CREATE, ORDERS_APPROVE);
            }
        }

        @Test
        @DisplayName("exposes the cached snapshot")
        void snapshot() {
            var item = evaluator.getUserPermissionCacheItem(TenantContext.tenant(5), alice.id());

            assertThat(item).isPresent();
            assertThat(item.get().roleIds()).hasSize(1);
        }
    }

    @Test
    @DisplayName("counts checks by outcome")
    void metrics() {
        evaluator.isGranted(TenantContext.tenant(5), alice.id(), ORDERS_CREATE);
        evaluator.isGranted(TenantContext.tenant(5), alice.id(), REPORTS_VIEW);
        evaluator.isGranted(TenantContext.tenant(5), alice.id(), REPORTS_VIEW);

        assertThat(registry.get("tessera.permission.checks").tag("outcome", "granted").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("tessera.permission.checks").tag("outcome", "denied").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("tessera.permission.evaluation").timer().count()).isEqualTo(3);
    }
}
