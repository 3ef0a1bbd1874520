package com.tessera.identity.permission;

/**
 * A user-specific permission setting.
 *
 * @param name    the permission name
 * @param granted true for an explicit grant, false for an explicit prohibition
 */
public record PermissionGrantInfo(String name, boolean granted) {

    public static PermissionGrantInfo granted(String name) {
        return new PermissionGrantInfo(name, true);
    }

    public static PermissionGrantInfo prohibited(String name) {
        return new PermissionGrantInfo(name, false);
    }
}
