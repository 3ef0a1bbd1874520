package com.tessera.identity.organization;

import com.tessera.identity.EntityNotFoundException;
import com.tessera.specification.Specification;
import java.util.List;
import java.util.Optional;

/**
 * Read access to organization units.
 */
public interface OrganizationUnitRepository {

    Optional<OrganizationUnit> findById(long id);

    /** Every unit satisfying the specification. */
    List<OrganizationUnit> findAll(Specification<OrganizationUnit> specification);

    /**
     * Gets a unit by id.
     *
     * @throws EntityNotFoundException if no unit has that id
     */
    default OrganizationUnit get(long id) {
        return findById(id).orElseThrow(() -> new EntityNotFoundException("OrganizationUnit", id));
    }
}
