package com.tessera.identity.permission;

/**
 * Reads whether a feature is enabled for a tenant.
 */
@FunctionalInterface
public interface FeatureChecker {

    /**
     * @param tenantId    the tenant, null when multi-tenancy is disabled
     * @param featureName the feature to look up
     */
    boolean isEnabled(Long tenantId, String featureName);
}
