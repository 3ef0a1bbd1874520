package com.tessera.identity.permission;

import java.util.List;

/**
 * Feature dependency on a list of feature names.
 *
 * @param featureNames the features to check
 * @param requiresAll  true when every feature must be enabled, false when any one suffices
 */
public record SimpleFeatureDependency(List<String> featureNames, boolean requiresAll)
        implements FeatureDependency {

    public SimpleFeatureDependency {
        if (featureNames == null || featureNames.isEmpty()) {
            throw new IllegalArgumentException("featureNames must not be empty");
        }
        featureNames = List.copyOf(featureNames);
    }

    /** Requires any of the given features. */
    public static SimpleFeatureDependency anyOf(String... featureNames) {
        return new SimpleFeatureDependency(List.of(featureNames), false);
    }

    /** Requires all of the given features. */
    public static SimpleFeatureDependency allOf(String... featureNames) {
        return new SimpleFeatureDependency(List.of(featureNames), true);
    }

    @Override
    public boolean isSatisfied(FeatureDependencyContext context) {
        FeatureChecker checker = context.featureChecker();
        if (requiresAll) {
            return featureNames.stream().allMatch(f -> checker.isEnabled(context.tenantId(), f));
        }
        return featureNames.stream().anyMatch(f -> checker.isEnabled(context.tenantId(), f));
    }
}
