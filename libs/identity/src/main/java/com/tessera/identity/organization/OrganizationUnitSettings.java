package com.tessera.identity.organization;

/**
 * Organization-unit policy values.
 */
public interface OrganizationUnitSettings {

    /**
     * Maximum number of units a user of the tenant may belong to.
     *
     * @param tenantId the tenant, null for host users
     */
    int getMaxUserMembershipCount(Long tenantId);
}
