package com.tessera.identity.organization;

/**
 * Membership of a user in an organization unit.
 *
 * @param tenantId           tenant of the user, null for host users
 * @param userId             the member
 * @param organizationUnitId the unit
 */
public record UserOrganizationUnit(Long tenantId, long userId, long organizationUnitId) {}
