package com.tessera.multitenancy;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the current {@link TenantContext}.
 *
 * <p>Resolution order:
 * <ul>
 *   <li>If a unit of work is active, its tenant id is used. The side is HOST when multi-tenancy
 *       is enabled and the unit of work has no tenant, TENANT otherwise.</li>
 *   <li>Otherwise the session's tenant id and side are used.</li>
 * </ul>
 */
public class TenantContextResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantContextResolver.class);

    private final UnitOfWorkManager unitOfWorkManager;
    private final TenantSession session;
    private final boolean multiTenancyEnabled;

    /**
     * @param unitOfWorkManager   source of the active unit of work
     * @param session             fallback when no unit of work is active
     * @param multiTenancyEnabled whether the deployment runs with multi-tenancy enabled
     */
    public TenantContextResolver(
            UnitOfWorkManager unitOfWorkManager, TenantSession session, boolean multiTenancyEnabled) {
        if (unitOfWorkManager == null) {
            throw new IllegalArgumentException("unitOfWorkManager must not be null");
        }
        if (session == null) {
            throw new IllegalArgumentException("session must not be null");
        }
        this.unitOfWorkManager = unitOfWorkManager;
        this.session = session;
        this.multiTenancyEnabled = multiTenancyEnabled;
    }

    /**
     * Resolves the tenant id and side in one step.
     *
     * @return the context to use for the rest of the call
     */
    public TenantContext resolve() {
        Optional<UnitOfWork> unitOfWork = unitOfWorkManager.current();
        TenantContext context;
        if (unitOfWork.isPresent()) {
            Long tenantId = unitOfWork.get().tenantId().orElse(null);
            MultiTenancySide side = multiTenancyEnabled && tenantId == null
                    ? MultiTenancySide.HOST
                    : MultiTenancySide.TENANT;
            context = new TenantContext(tenantId, side);
        } else {
            context = new TenantContext(session.tenantId().orElse(null), session.multiTenancySide());
        }
        log.debug("Resolved tenant context tenantId={} side={}", context.tenantId(), context.side());
        return context;
    }

    /** Whether multi-tenancy is enabled for this deployment. */
    public boolean isMultiTenancyEnabled() {
        return multiTenancyEnabled;
    }
}
