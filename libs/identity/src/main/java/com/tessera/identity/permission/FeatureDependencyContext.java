package com.tessera.identity.permission;

/**
 * Inputs of a {@link FeatureDependency} check.
 *
 * @param tenantId       the tenant being evaluated; null when multi-tenancy is disabled
 * @param featureChecker source of the tenant's feature state
 */
public record FeatureDependencyContext(Long tenantId, FeatureChecker featureChecker) {}
