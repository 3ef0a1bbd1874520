package com.tessera.identity.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the identity services, bound from {@code tessera.identity.*}.
 *
 * <pre>
 * tessera:
 *   identity:
 *     multi-tenancy-enabled: true
 *     admin-user-name: admin
 *     permission-cache:
 *       ttl: 60m
 *       maximum-size: 10000
 *     organization-units:
 *       max-user-membership-count: 2147483647
 * </pre>
 *
 * @param multiTenancyEnabled whether the deployment separates host and tenants
 * @param adminUserName       name of the built-in admin account (default "admin")
 * @param permissionCache     permission snapshot cache bounds
 * @param organizationUnits   organization-unit policy defaults
 */
@ConfigurationProperties(prefix = "tessera.identity")
@Validated
public record IdentityProperties(
        boolean multiTenancyEnabled,
        @NotBlank String adminUserName,
        @NotNull @Valid PermissionCache permissionCache,
        @NotNull @Valid OrganizationUnits organizationUnits) {

    public static final String DEFAULT_ADMIN_USER_NAME = "admin";

    /** Unset values take their defaults; explicit values are left to Bean Validation. */
    public IdentityProperties {
        if (adminUserName == null) {
            adminUserName = DEFAULT_ADMIN_USER_NAME;
        }
        if (permissionCache == null) {
            permissionCache = new PermissionCache(null, null);
        }
        if (organizationUnits == null) {
            organizationUnits = new OrganizationUnits(null);
        }
    }

    /**
     * @param ttl         how long a loaded snapshot stays valid (default 60 minutes)
     * @param maximumSize maximum number of cached snapshots (default 10000)
     */
    public record PermissionCache(@NotNull @DurationMin(seconds = 1) Duration ttl, @NotNull @Min(1) Long maximumSize) {

        public static final Duration DEFAULT_TTL = Duration.ofMinutes(60);
        public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

        public PermissionCache {
            if (ttl == null) {
                ttl = DEFAULT_TTL;
            }
            if (maximumSize == null) {
                maximumSize = DEFAULT_MAXIMUM_SIZE;
            }
        }
    }

    /**
     * @param maxUserMembershipCount default limit when no setting overrides it (default unlimited)
     */
    public record OrganizationUnits(@NotNull @Min(1) Integer maxUserMembershipCount) {

        public OrganizationUnits {
            if (maxUserMembershipCount == null) {
                maxUserMembershipCount = Integer.MAX_VALUE;
            }
        }
    }
}
