package com.tessera.identity.organization;

import static com.tessera.identity.organization.OrganizationUnitSpecifications.codeStartsWith;
import static com.tessera.identity.organization.OrganizationUnitSpecifications.idIn;
import static com.tessera.identity.organization.OrganizationUnitSpecifications.memberIs;
import static com.tessera.identity.organization.OrganizationUnitSpecifications.tenantIs;
import static com.tessera.identity.organization.OrganizationUnitSpecifications.unitIn;
import static com.tessera.identity.organization.OrganizationUnitSpecifications.unitIs;

import com.tessera.identity.EntityNotFoundException;
import com.tessera.identity.user.UserIdentity;
import com.tessera.identity.user.UserStore;
import com.tessera.multitenancy.TenantIsolationEnforcer;
import com.tessera.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manages which organization units a user belongs to.
 *
 * <p>The tenant's maximum membership count is checked before memberships are created. The check
 * and the insert are not atomic: concurrent adds for the same user may briefly exceed the limit.
 */
public class OrganizationUnitMembershipManager {

    private static final Logger log = LoggerFactory.getLogger(OrganizationUnitMembershipManager.class);

    private final UserStore userStore;
    private final OrganizationUnitRepository organizationUnitRepository;
    private final UserOrganizationUnitRepository membershipRepository;
    private final OrganizationUnitSettings settings;
    private final Counter policyRejections;

    public OrganizationUnitMembershipManager(
            UserStore userStore,
            OrganizationUnitRepository organizationUnitRepository,
            UserOrganizationUnitRepository membershipRepository,
            OrganizationUnitSettings settings,
            MetricFactory metrics) {
        this.userStore = userStore;
        this.organizationUnitRepository = organizationUnitRepository;
        this.membershipRepository = membershipRepository;
        this.settings = settings;
        this.policyRejections = metrics.counter(
                "organization-unit.membership.rejections", "Memberships rejected by the max count policy");
    }

    public boolean isInOrganizationUnit(long userId, long organizationUnitId) {
        return isInOrganizationUnit(getUser(userId), organizationUnitRepository.get(organizationUnitId));
    }

    public boolean isInOrganizationUnit(UserIdentity user, OrganizationUnit organizationUnit) {
        return membershipRepository.count(memberIs(user.id()).and(unitIs(organizationUnit.id()))) > 0;
    }

    public void addToOrganizationUnit(long userId, long organizationUnitId) {
        addToOrganizationUnit(getUser(userId), organizationUnitRepository.get(organizationUnitId));
    }

    /**
     * Adds the user to the unit. Does nothing if the user is already a member.
     *
     * @throws MaxMembershipExceededException if the user already has the maximum number of units
     * @throws com.tessera.multitenancy.TenantMismatchException if the unit belongs to another
     *     tenant than the user
     */
    public void addToOrganizationUnit(UserIdentity user, OrganizationUnit organizationUnit) {
        List<UserOrganizationUnit> memberships = membershipRepository.findAll(memberIs(user.id()));
        if (memberships.stream().anyMatch(m -> m.organizationUnitId() == organizationUnit.id())) {
            return;
        }

        TenantIsolationEnforcer.enforce(user.tenantId(), organizationUnit.tenantId());
        checkMaxMembershipCount(user.tenantId(), memberships.size() + 1);

        membershipRepository.insert(new UserOrganizationUnit(user.tenantId(), user.id(), organizationUnit.id()));
        log.info("Added user {} to organization unit {}", user.id(), organizationUnit.code());
    }

    public void removeFromOrganizationUnit(long userId, long organizationUnitId) {
        removeFromOrganizationUnit(getUser(userId), organizationUnitRepository.get(organizationUnitId));
    }

    /** Removes the user from the unit. Does nothing if the user is not a member. */
    public void removeFromOrganizationUnit(UserIdentity user, OrganizationUnit organizationUnit) {
        int deleted = membershipRepository.delete(memberIs(user.id()).and(unitIs(organizationUnit.id())));
        if (deleted > 0) {
            log.info("Removed user {} from organization unit {}", user.id(), organizationUnit.code());
        }
    }

    public void setOrganizationUnits(long userId, long... organizationUnitIds) {
        Set<Long> ids = new LinkedHashSet<>();
        if (organizationUnitIds != null) {
            for (long id : organizationUnitIds) {
                ids.add(id);
            }
        }
        setOrganizationUnits(getUser(userId), ids);
    }

    /**
     * Makes the user a member of exactly the given units. Memberships not in the list are removed
     * first, then missing ones are added.
     *
     * @param user                the user
     * @param organizationUnitIds target unit ids; null means none
     * @throws MaxMembershipExceededException if the list is longer than the tenant allows; nothing
     *     is changed in that case
     * @throws EntityNotFoundException if a target unit does not exist
     */
    public void setOrganizationUnits(UserIdentity user, Collection<Long> organizationUnitIds) {
        Set<Long> target = organizationUnitIds == null ? Set.of() : new LinkedHashSet<>(organizationUnitIds);
        checkMaxMembershipCount(user.tenantId(), target.size());

        List<OrganizationUnit> current = getOrganizationUnits(user);
        for (OrganizationUnit unit : current) {
            if (!target.contains(unit.id())) {
                removeFromOrganizationUnit(user, unit);
            }
        }

        Set<Long> currentIds = new LinkedHashSet<>();
        current.forEach(unit -> currentIds.add(unit.id()));
        for (Long id : target) {
            if (!currentIds.contains(id)) {
                addToOrganizationUnit(user, organizationUnitRepository.get(id));
            }
        }
    }

    /** The units the user belongs to. */
    public List<OrganizationUnit> getOrganizationUnits(UserIdentity user) {
        List<Long> unitIds = membershipRepository.findAll(memberIs(user.id())).stream()
                .map(UserOrganizationUnit::organizationUnitId)
                .toList();
        if (unitIds.isEmpty()) {
            return List.of();
        }
        return organizationUnitRepository.findAll(idIn(unitIds));
    }

    /**
     * Members of a unit.
     *
     * @param organizationUnit the unit
     * @param includeChildren  also return members of every unit of the same tenant whose code starts
     *                         with this unit's code
     * @return distinct users in membership order
     */
    public List<UserIdentity> getUsersInOrganizationUnit(OrganizationUnit organizationUnit, boolean includeChildren) {
        List<UserOrganizationUnit> memberships;
        if (!includeChildren) {
            memberships = membershipRepository.findAll(unitIs(organizationUnit.id()));
        } else {
            List<Long> unitIds = organizationUnitRepository
                    .findAll(codeStartsWith(organizationUnit.code()).and(tenantIs(organizationUnit.tenantId())))
                    .stream()
                    .map(OrganizationUnit::id)
                    .toList();
            memberships = unitIds.isEmpty() ? List.of() : membershipRepository.findAll(unitIn(unitIds));
        }

        Set<Long> userIds = new LinkedHashSet<>();
        memberships.forEach(m -> userIds.add(m.userId()));
        return userIds.stream()
                .map(userStore::findById)
                .flatMap(Optional::stream)
                .toList();
    }

    private void checkMaxMembershipCount(Long tenantId, int requestedCount) {
        int maxCount = settings.getMaxUserMembershipCount(tenantId);
        if (requestedCount > maxCount) {
            policyRejections.increment();
            log.warn("Organization unit membership of {} exceeds the limit of {} for tenant {}",
                    requestedCount, maxCount, tenantId);
            throw new MaxMembershipExceededException(maxCount, requestedCount);
        }
    }

    private UserIdentity getUser(long userId) {
        return userStore.findById(userId).orElseThrow(() -> new EntityNotFoundException("User", userId));
    }
}
