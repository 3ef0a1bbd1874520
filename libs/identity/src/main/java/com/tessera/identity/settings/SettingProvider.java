package com.tessera.identity.settings;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Typed access to application- and tenant-level settings.
 *
 * <p>The async variants default to completed futures of the blocking reads; backends with
 * non-blocking I/O override them.
 */
public interface SettingProvider {

    /** Application-wide value of a setting, empty if not set. */
    <T> Optional<T> getSettingValueForApplication(String name, Class<T> type);

    /** Value of a setting for a tenant, empty if not set at any level. */
    <T> Optional<T> getSettingValueForTenant(String name, long tenantId, Class<T> type);

    default <T> CompletableFuture<Optional<T>> getSettingValueForApplicationAsync(String name, Class<T> type) {
        return CompletableFuture.completedFuture(getSettingValueForApplication(name, type));
    }

    default <T> CompletableFuture<Optional<T>> getSettingValueForTenantAsync(
            String name, long tenantId, Class<T> type) {
        return CompletableFuture.completedFuture(getSettingValueForTenant(name, tenantId, type));
    }

    /**
     * Reads the tenant value when a tenant id is given, the application value otherwise.
     *
     * @param tenantId the tenant, or null for host callers
     */
    default <T> Optional<T> getSettingValue(String name, Long tenantId, Class<T> type) {
        return tenantId == null
                ? getSettingValueForApplication(name, type)
                : getSettingValueForTenant(name, tenantId, type);
    }

    /** Async counterpart of {@link #getSettingValue(String, Long, Class)}. */
    default <T> CompletableFuture<Optional<T>> getSettingValueAsync(String name, Long tenantId, Class<T> type) {
        return tenantId == null
                ? getSettingValueForApplicationAsync(name, type)
                : getSettingValueForTenantAsync(name, tenantId, type);
    }
}
