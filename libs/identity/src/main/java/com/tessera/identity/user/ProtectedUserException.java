package com.tessera.identity.user;

import com.tessera.identity.UserFriendlyException;

/**
 * Thrown when an operation would rename or delete the admin user.
 */
public class ProtectedUserException extends UserFriendlyException {

    public static final String CAN_NOT_RENAME_ADMIN_USER = "CanNotRenameAdminUser";
    public static final String CAN_NOT_DELETE_ADMIN_USER = "CanNotDeleteAdminUser";

    private ProtectedUserException(String messageKey, String defaultMessage, String adminUserName) {
        super(messageKey, defaultMessage, adminUserName);
    }

    public static ProtectedUserException rename(String adminUserName) {
        return new ProtectedUserException(
                CAN_NOT_RENAME_ADMIN_USER, "Can not rename the admin user '%s'.", adminUserName);
    }

    public static ProtectedUserException delete(String adminUserName) {
        return new ProtectedUserException(
                CAN_NOT_DELETE_ADMIN_USER, "Can not delete the admin user '%s'.", adminUserName);
    }
}
