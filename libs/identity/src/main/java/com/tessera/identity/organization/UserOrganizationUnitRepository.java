package com.tessera.identity.organization;

import com.tessera.specification.Specification;
import java.util.List;

/**
 * Persistence of {@link UserOrganizationUnit} memberships.
 */
public interface UserOrganizationUnitRepository {

    /** Every membership satisfying the specification, in insertion order. */
    List<UserOrganizationUnit> findAll(Specification<UserOrganizationUnit> specification);

    long count(Specification<UserOrganizationUnit> specification);

    void insert(UserOrganizationUnit membership);

    /**
     * Deletes every membership satisfying the specification.
     *
     * @return the number of deleted memberships
     */
    int delete(Specification<UserOrganizationUnit> specification);
}
