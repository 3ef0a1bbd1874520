package com.tessera.multitenancy;

import java.util.EnumSet;
import java.util.Set;

/**
 * The side of a multi-tenant deployment a caller operates on.
 *
 * <p>HOST operates above all tenants; TENANT operates inside exactly one tenant.
 */
public enum MultiTenancySide {

    HOST("host"),
    TENANT("tenant");

    private final String value;

    MultiTenancySide(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }

    /** Both sides, as a mutable set. */
    public static Set<MultiTenancySide> both() {
        return EnumSet.allOf(MultiTenancySide.class);
    }
}
