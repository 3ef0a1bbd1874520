package com.tessera.identity.permission;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog built once from the application's permission definitions.
 */
public final class DefaultPermissionCatalog implements PermissionCatalog {

    private final Map<String, Permission> permissions;
    private final List<Permission> ordered;

    /**
     * @param definitions the permissions to expose
     * @throws IllegalArgumentException if two definitions share a name
     */
    public DefaultPermissionCatalog(Collection<Permission> definitions) {
        Map<String, Permission> byName = new LinkedHashMap<>();
        for (Permission permission : definitions) {
            if (byName.putIfAbsent(permission.name(), permission) != null) {
                throw new IllegalArgumentException("Duplicate permission name: " + permission.name());
            }
        }
        this.permissions = Map.copyOf(byName);
        this.ordered = List.copyOf(byName.values());
    }

    public static DefaultPermissionCatalog of(Permission... definitions) {
        return new DefaultPermissionCatalog(List.of(definitions));
    }

    @Override
    public Optional<Permission> findPermission(String name) {
        return Optional.ofNullable(name).map(permissions::get);
    }

    @Override
    public List<Permission> getAllPermissions() {
        return ordered;
    }
}
