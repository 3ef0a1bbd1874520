package com.tessera.identity.organization;

import com.tessera.specification.Specification;
import com.tessera.specification.Specifications;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Specifications used to query units and memberships.
 */
public final class OrganizationUnitSpecifications {

    private OrganizationUnitSpecifications() {
        // utility class
    }

    /** Units whose code starts with the given code: the unit itself and its descendants. */
    public static Specification<OrganizationUnit> codeStartsWith(String code) {
        return Specifications.of(ou -> ou.code().startsWith(code));
    }

    /** Units owned by the given tenant (null for host units). */
    public static Specification<OrganizationUnit> tenantIs(Long tenantId) {
        return Specifications.of(ou -> Objects.equals(ou.tenantId(), tenantId));
    }

    /** Units with one of the given ids. */
    public static Specification<OrganizationUnit> idIn(Collection<Long> ids) {
        Set<Long> idSet = Set.copyOf(ids);
        return Specifications.of(ou -> idSet.contains(ou.id()));
    }

    /** Memberships of the given user. */
    public static Specification<UserOrganizationUnit> memberIs(long userId) {
        return Specifications.of(uou -> uou.userId() == userId);
    }

    /** Memberships in the given unit. */
    public static Specification<UserOrganizationUnit> unitIs(long organizationUnitId) {
        return Specifications.of(uou -> uou.organizationUnitId() == organizationUnitId);
    }

    /** Memberships in any of the given units. */
    public static Specification<UserOrganizationUnit> unitIn(Collection<Long> organizationUnitIds) {
        Set<Long> idSet = Set.copyOf(organizationUnitIds);
        return Specifications.of(uou -> idSet.contains(uou.organizationUnitId()));
    }
}
