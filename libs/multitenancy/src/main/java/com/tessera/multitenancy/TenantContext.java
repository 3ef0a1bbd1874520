package com.tessera.multitenancy;

/**
 * Tenant id and multi-tenancy side resolved for the duration of one call.
 *
 * <p>Resolved once by {@link TenantContextResolver} and then passed explicitly through the call
 * chain, so a change of the ambient tenant in the middle of an evaluation is never observed.
 *
 * @param tenantId the current tenant, or null when no tenant is bound (host side)
 * @param side     the current multi-tenancy side
 */
public record TenantContext(Long tenantId, MultiTenancySide side) {

    /** Tenant id used in keys when no tenant is bound. */
    public static final long NO_TENANT = 0L;

    public TenantContext {
        if (side == null) {
            throw new IllegalArgumentException("side must not be null");
        }
    }

    /** Context of a caller operating on the host side. */
    public static TenantContext host() {
        return new TenantContext(null, MultiTenancySide.HOST);
    }

    /** Context of a caller operating inside the given tenant. */
    public static TenantContext tenant(long tenantId) {
        return new TenantContext(tenantId, MultiTenancySide.TENANT);
    }

    /** Whether a tenant id is bound. */
    public boolean hasTenant() {
        return tenantId != null;
    }

    /** The tenant id, or {@link #NO_TENANT} when none is bound. */
    public long tenantIdOrDefault() {
        return tenantId != null ? tenantId : NO_TENANT;
    }
}
