package com.tessera.multitenancy;

/**
 * Thrown when an operation combines records that belong to different tenants.
 */
public class TenantMismatchException extends RuntimeException {

    private final Long expectedTenantId;
    private final Long actualTenantId;

    public TenantMismatchException(Long expectedTenantId, Long actualTenantId) {
        super("Tenant mismatch: tenant '%s' cannot access resource of tenant '%s'"
                .formatted(describe(expectedTenantId), describe(actualTenantId)));
        this.expectedTenantId = expectedTenantId;
        this.actualTenantId = actualTenantId;
    }

    /** The tenant of the caller or owning record; null for host. */
    public Long expectedTenantId() {
        return expectedTenantId;
    }

    /** The tenant of the resource being accessed; null for host. */
    public Long actualTenantId() {
        return actualTenantId;
    }

    private static String describe(Long tenantId) {
        return tenantId == null ? "host" : tenantId.toString();
    }
}
