package com.tessera.identity.organization;

/**
 * A node of a tenant's organization tree.
 *
 * <p>The code encodes the position in the tree: every descendant's code starts with the code of
 * its ancestors (e.g., {@code 00001} and {@code 00001.00002}).
 *
 * @param id          unit id
 * @param tenantId    owning tenant, null for host units
 * @param code        hierarchical code
 * @param displayName human-readable name
 */
public record OrganizationUnit(long id, Long tenantId, String code, String displayName) {

    public OrganizationUnit {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must not be null or blank");
        }
    }
}
