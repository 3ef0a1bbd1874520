package com.tessera.identity.user;

import com.tessera.identity.UserFriendlyException;

/**
 * Thrown when a user name or email address is already used by another user.
 */
public class DuplicateUserException extends UserFriendlyException {

    public static final String DUPLICATE_USER_NAME = "Identity.DuplicateUserName";
    public static final String DUPLICATE_EMAIL = "Identity.DuplicateEmail";

    private final long existingUserId;

    private DuplicateUserException(String messageKey, String defaultMessage, String value, long existingUserId) {
        super(messageKey, defaultMessage, value);
        this.existingUserId = existingUserId;
    }

    public static DuplicateUserException userName(String userName, long existingUserId) {
        return new DuplicateUserException(
                DUPLICATE_USER_NAME, "User name '%s' is already taken.", userName, existingUserId);
    }

    public static DuplicateUserException emailAddress(String emailAddress, long existingUserId) {
        return new DuplicateUserException(
                DUPLICATE_EMAIL, "Email address '%s' is already taken.", emailAddress, existingUserId);
    }

    /** Id of the user that already owns the name or address. */
    public long existingUserId() {
        return existingUserId;
    }
}
