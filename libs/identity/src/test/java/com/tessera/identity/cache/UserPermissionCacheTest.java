package com.tessera.identity.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.tessera.identity.EntityNotFoundException;
import com.tessera.identity.MissingCapabilityException;
import com.tessera.identity.permission.PermissionGrantInfo;
import com.tessera.identity.permission.PermissionStore;
import com.tessera.identity.role.RoleIdentity;
import com.tessera.identity.testing.InMemoryRoleManager;
import com.tessera.identity.testing.InMemoryUserStore;
import com.tessera.identity.testing.TestUser;
import com.tessera.identity.user.UserStore;
import com.tessera.multitenancy.TenantContext;
import com.tessera.observability.MetricFactory;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("UserPermissionCache")
class UserPermissionCacheTest {

    private InMemoryUserStore userStore;
    private InMemoryRoleManager roleManager;
    private SingleFlightCache<String, UserPermissionCacheItem> backing;
    private UserPermissionCache cache;

    @BeforeEach
    void setUp() {
        userStore = new InMemoryUserStore();
        roleManager = new InMemoryRoleManager();
        backing = new SingleFlightCache<>("user-permissions", Duration.ofMinutes(5), 100,
                MetricFactory.standalone("permission-cache"));
        cache = new UserPermissionCache(backing, userStore, roleManager);
    }

    @Test
    @DisplayName("cache key combines user id and tenant id, 0 without tenant")
    void cacheKey() {
        assertThat(UserPermissionCache.cacheKey(42, TenantContext.tenant(5))).isEqualTo("42@5");
        assertThat(UserPermissionCache.cacheKey(42, TenantContext.host())).isEqualTo("42@0");
    }

    @Test
    @DisplayName("should reject a user store without permission storage")
    void missingCapability() {
        UserStore plainStore = mock(UserStore.class);

        assertThatThrownBy(() -> new UserPermissionCache(backing, plainStore, roleManager))
                .isInstanceOf(MissingCapabilityException.class)
                .satisfies(e -> assertThat(((MissingCapabilityException) e).requiredCapability())
                        .isEqualTo(PermissionStore.class));
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("maps role names to ids and splits settings by polarity")
        void buildsSnapshot() {
            RoleIdentity manager = roleManager.addRole(5L, "Manager");
            RoleIdentity clerk = roleManager.addRole(5L, "Clerk");
            userStore.addUser(TestUser.of(1, 5L, "alice"), "Manager", "Clerk");
            userStore.addPermission(1, PermissionGrantInfo.granted("Orders.Create"));
            userStore.addPermission(1, PermissionGrantInfo.prohibited("Orders.Delete"));

            UserPermissionCacheItem item = cache.get(1, TenantContext.tenant(5)).orElseThrow();

            assertThat(item.userId()).isEqualTo(1);
            assertThat(item.roleIds()).containsExactly(manager.id(), clerk.id());
            assertThat(item.grantedPermissions()).containsExactly("Orders.Create");
            assertThat(item.prohibitedPermissions()).containsExactly("Orders.Delete");
        }

        @Test
        @DisplayName("a missing user yields no snapshot and nothing is cached")
        void missingUser() {
            assertThat(cache.get(99, TenantContext.host())).isEmpty();
            assertThat(backing.contains("99@0")).isFalse();
        }

        @Test
        @DisplayName("a user of another tenant yields no snapshot")
        void userOfOtherTenant() {
            roleManager.addRole(5L, "Manager");
            userStore.addUser(TestUser.of(1, 5L, "alice"), "Manager");

            assertThat(cache.get(1, TenantContext.tenant(7))).isEmpty();
            assertThat(cache.get(1, TenantContext.host())).isEmpty();
            assertThat(backing.contains("1@7")).isFalse();
            assertThat(cache.get(1, TenantContext.tenant(5))).isPresent();
        }

        @Test
        @DisplayName("resolves role names within the user's tenant")
        void tenantScopedRoles() {
            roleManager.addRole(7L, "Manager");
            RoleIdentity manager = roleManager.addRole(5L, "Manager");
            roleManager.addRole("Manager");
            userStore.addUser(TestUser.of(1, 5L, "alice"), "Manager");

            assertThat(cache.get(1, TenantContext.tenant(5)).orElseThrow().roleIds())
                    .containsExactly(manager.id());
        }

        @Test
        @DisplayName("an unknown role name fails the load")
        void unknownRole() {
            userStore.addUser(TestUser.of(1, null, "alice"), "Ghost");

            assertThatThrownBy(() -> cache.get(1, TenantContext.host()))
                    .isInstanceOf(EntityNotFoundException.class)
                    .hasMessageContaining("Ghost");
            assertThat(backing.contains("1@0")).isFalse();
        }

        @Test
        @DisplayName("serves repeated reads from the cached snapshot")
        void cachesSnapshot() {
            userStore.addUser(TestUser.of(1, null, "alice"));

            cache.get(1, TenantContext.host());
            cache.get(1, TenantContext.host());

            assertThat(userStore.roleNameReads()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @Test
        @DisplayName("invalidate evicts the user's keys only")
        void invalidateUser() {
            userStore.addUser(TestUser.of(1, 5L, "alice"));
            userStore.addUser(TestUser.of(11, 5L, "bob"));
            cache.get(1, TenantContext.tenant(5));
            cache.get(11, TenantContext.tenant(5));

            cache.invalidate(1);

            assertThat(backing.contains("1@5")).isFalse();
            assertThat(backing.contains("11@5")).isTrue();
        }

        @Test
        @DisplayName("later reads observe store changes after invalidation")
        void readAfterInvalidate() {
            userStore.addUser(TestUser.of(1, null, "alice"));
            assertThat(cache.get(1, TenantContext.host()).orElseThrow().grantedPermissions()).isEmpty();

            userStore.addPermission(1, PermissionGrantInfo.granted("Orders.Create"));
            cache.invalidate(1);

            assertThat(cache.get(1, TenantContext.host()).orElseThrow().grantedPermissions())
                    .containsExactly("Orders.Create");
        }

        @Test
        @DisplayName("invalidateAll clears every snapshot")
        void invalidateAll() {
            userStore.addUser(TestUser.of(1, null, "alice"));
            cache.get(1, TenantContext.host());

            cache.invalidateAll();

            assertThat(backing.estimatedSize()).isZero();
        }
    }
}
