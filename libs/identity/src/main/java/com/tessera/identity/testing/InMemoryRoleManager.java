package com.tessera.identity.testing;

import com.tessera.identity.permission.Permission;
import com.tessera.identity.role.RoleIdentity;
import com.tessera.identity.role.RoleManager;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link RoleManager}; each role carries a fixed set of granted permission names.
 */
public class InMemoryRoleManager implements RoleManager {

    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, TestRole> rolesById = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> grants = new ConcurrentHashMap<>();

    /** Adds a host role granting the given permissions. */
    public TestRole addRole(String name, String... grantedPermissions) {
        return addRole(null, name, grantedPermissions);
    }

    /** Adds a role of the tenant granting the given permissions. */
    public TestRole addRole(Long tenantId, String name, String... grantedPermissions) {
        TestRole role = new TestRole(ids.incrementAndGet(), tenantId, name);
        rolesById.put(role.id(), role);
        grants.put(role.id(), Set.of(grantedPermissions));
        return role;
    }

    @Override
    public Optional<RoleIdentity> findById(long roleId) {
        return Optional.ofNullable(rolesById.get(roleId));
    }

    @Override
    public Optional<RoleIdentity> findByName(Long tenantId, String roleName) {
        return rolesById.values().stream()
                .filter(role -> Objects.equals(role.tenantId(), tenantId) && role.name().equals(roleName))
                .<RoleIdentity>map(role -> role)
                .findFirst();
    }

    @Override
    public boolean isGranted(long roleId, Permission permission) {
        return grants.getOrDefault(roleId, Set.of()).contains(permission.name());
    }
}
