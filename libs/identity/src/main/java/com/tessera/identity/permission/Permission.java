package com.tessera.identity.permission;

import com.tessera.multitenancy.MultiTenancySide;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A named capability defined by the hosting application at startup.
 *
 * <p>Permissions are equal when their names are equal; the name is the catalog key.
 *
 * @param name              unique permission name (e.g., "Orders.Approve")
 * @param displayName       human-readable name, defaults to the name
 * @param multiTenancySides the sides on which the permission can be granted
 * @param featureDependency features the tenant must have enabled, or null
 */
public record Permission(
        String name,
        String displayName,
        Set<MultiTenancySide> multiTenancySides,
        FeatureDependency featureDependency) {

    public Permission {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = name;
        }
        if (multiTenancySides == null) {
            multiTenancySides = MultiTenancySide.both();
        }
        if (multiTenancySides.isEmpty()) {
            throw new IllegalArgumentException("multiTenancySides must not be empty: " + name);
        }
        multiTenancySides = Collections.unmodifiableSet(EnumSet.copyOf(multiTenancySides));
    }

    /** A permission available on both sides without feature dependency. */
    public static Permission of(String name) {
        return new Permission(name, null, null, null);
    }

    /** A permission restricted to the given sides. */
    public static Permission of(String name, MultiTenancySide first, MultiTenancySide... rest) {
        return new Permission(name, null, EnumSet.of(first, rest), null);
    }

    /** A copy of this permission that depends on the given features. */
    public Permission withFeatureDependency(FeatureDependency dependency) {
        return new Permission(name, displayName, multiTenancySides, dependency);
    }

    /** Whether the permission can be granted on the given side. */
    public boolean isAvailableOn(MultiTenancySide side) {
        return multiTenancySides.contains(side);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Permission other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
