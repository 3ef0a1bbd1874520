package com.tessera.identity.permission;

import com.tessera.identity.MissingCapabilityException;
import com.tessera.identity.user.UserStore;
import java.util.List;

/**
 * Capability of a {@link UserStore} that persists per-user permission settings.
 */
public interface PermissionStore {

    /** Every setting stored for the user. */
    List<PermissionGrantInfo> getPermissions(long userId);

    /** Stores a setting; storing an identical setting twice keeps one record. */
    void addPermission(long userId, PermissionGrantInfo permissionGrant);

    /** Removes a setting; no-op when absent. */
    void removePermission(long userId, PermissionGrantInfo permissionGrant);

    /** Removes every setting of the user. */
    void removeAllPermissionSettings(long userId);

    /**
     * Returns the store as a {@link PermissionStore}.
     *
     * @throws MissingCapabilityException if the store cannot persist permission settings
     */
    static PermissionStore requireFrom(UserStore userStore) {
        if (userStore instanceof PermissionStore permissionStore) {
            return permissionStore;
        }
        throw new MissingCapabilityException(
                userStore == null ? UserStore.class : userStore.getClass(), PermissionStore.class);
    }
}
