package com.tessera.identity.permission;

/**
 * Feature requirement of a permission, checked on the tenant side only.
 */
@FunctionalInterface
public interface FeatureDependency {

    boolean isSatisfied(FeatureDependencyContext context);
}
