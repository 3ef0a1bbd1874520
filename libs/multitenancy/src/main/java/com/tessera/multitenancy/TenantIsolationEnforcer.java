package com.tessera.multitenancy;

import java.util.Objects;

/**
 * Verifies that a resource belongs to the expected tenant.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the context's tenant matches the resource's tenant.
     *
     * @param context          the resolved tenant context
     * @param resourceTenantId the tenant of the resource, null for host-owned resources
     * @throws TenantMismatchException if the tenants differ
     */
    public static void enforce(TenantContext context, Long resourceTenantId) {
        enforce(context.tenantId(), resourceTenantId);
    }

    /**
     * Verifies that two tenant ids are the same. Two host (null) ids match.
     *
     * @throws TenantMismatchException if the tenants differ
     */
    public static void enforce(Long expectedTenantId, Long actualTenantId) {
        if (!Objects.equals(expectedTenantId, actualTenantId)) {
            throw new TenantMismatchException(expectedTenantId, actualTenantId);
        }
    }
}
