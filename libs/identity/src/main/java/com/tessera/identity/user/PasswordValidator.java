package com.tessera.identity.user;

import com.tessera.identity.IdentityResult;

/**
 * Checks a candidate password for a user.
 */
@FunctionalInterface
public interface PasswordValidator {

    IdentityResult validate(UserIdentity user, String password);
}
