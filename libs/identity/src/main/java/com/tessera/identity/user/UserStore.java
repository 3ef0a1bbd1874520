package com.tessera.identity.user;

import com.tessera.identity.IdentityResult;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of users and their role memberships.
 *
 * <p>Stores that also persist per-user permission settings implement
 * {@link com.tessera.identity.permission.PermissionStore}.
 */
public interface UserStore {

    Optional<UserIdentity> findById(long userId);

    Optional<UserIdentity> findByName(String userName);

    Optional<UserIdentity> findByEmail(String emailAddress);

    /** Names of the roles the user currently holds, in stored order. */
    List<String> getRoleNames(long userId);

    /** Adds the user to a role. Failures are reported in the result, not thrown. */
    IdentityResult addToRole(UserIdentity user, String roleName);

    /** Removes the user from a role. Failures are reported in the result, not thrown. */
    IdentityResult removeFromRole(UserIdentity user, String roleName);
}
