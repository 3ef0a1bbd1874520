package com.tessera.identity.user;

import com.tessera.identity.EntityNotFoundException;
import com.tessera.identity.IdentityError;
import com.tessera.identity.IdentityResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User lookups and the guards account operations run before they touch the store.
 */
public class UserManager {

    private static final Logger log = LoggerFactory.getLogger(UserManager.class);

    private final UserStore userStore;
    private final List<PasswordValidator> passwordValidators;
    private final String adminUserName;

    /**
     * @param userStore          the user store
     * @param passwordValidators every validator a new password must pass
     * @param adminUserName      name of the built-in admin account
     */
    public UserManager(UserStore userStore, List<PasswordValidator> passwordValidators, String adminUserName) {
        if (adminUserName == null || adminUserName.isBlank()) {
            throw new IllegalArgumentException("adminUserName must not be null or blank");
        }
        this.userStore = userStore;
        this.passwordValidators = List.copyOf(passwordValidators);
        this.adminUserName = adminUserName;
    }

    /**
     * Gets a user by id.
     *
     * @throws EntityNotFoundException if no user has that id
     */
    public UserIdentity getUserById(long userId) {
        return userStore.findById(userId).orElseThrow(() -> new EntityNotFoundException("User", userId));
    }

    /** Finds a user by user name, then by email address. */
    public Optional<UserIdentity> findByNameOrEmail(String userNameOrEmailAddress) {
        Optional<UserIdentity> byName = userStore.findByName(userNameOrEmailAddress);
        return byName.isPresent() ? byName : userStore.findByEmail(userNameOrEmailAddress);
    }

    /**
     * Verifies that no other user owns the user name or email address.
     *
     * @param expectedUserId the user being created (null) or updated
     * @throws DuplicateUserException if another user owns either value
     */
    public void checkDuplicateUsernameOrEmailAddress(Long expectedUserId, String userName, String emailAddress) {
        Optional<UserIdentity> byName = userStore.findByName(userName);
        if (byName.isPresent() && !isSameUser(byName.get(), expectedUserId)) {
            log.warn("User name {} already used by user {}", userName, byName.get().id());
            throw DuplicateUserException.userName(userName, byName.get().id());
        }

        Optional<UserIdentity> byEmail = userStore.findByEmail(emailAddress);
        if (byEmail.isPresent() && !isSameUser(byEmail.get(), expectedUserId)) {
            log.warn("Email address {} already used by user {}", emailAddress, byEmail.get().id());
            throw DuplicateUserException.emailAddress(emailAddress, byEmail.get().id());
        }
    }

    /**
     * Guards an update of the given user: the new name and address must be free and the admin
     * user keeps its name.
     *
     * @param user the user with its updated values
     * @throws DuplicateUserException if the new user name or email address is taken
     * @throws ProtectedUserException if the admin user would be renamed
     */
    public void checkCanUpdate(UserIdentity user) {
        checkDuplicateUsernameOrEmailAddress(user.id(), user.userName(), user.emailAddress());

        if (!adminUserName.equals(user.userName())) {
            String storedUserName = userStore.findById(user.id()).map(UserIdentity::userName).orElse(null);
            if (adminUserName.equals(storedUserName)) {
                throw ProtectedUserException.rename(adminUserName);
            }
        }
    }

    /**
     * Guards a delete of the given user.
     *
     * @throws ProtectedUserException if the user is the admin user
     */
    public void checkCanDelete(UserIdentity user) {
        if (adminUserName.equals(user.userName())) {
            throw ProtectedUserException.delete(adminUserName);
        }
    }

    /**
     * Runs every password validator and collects all their errors.
     *
     * @return success, or one failed result with the errors of every failing validator
     */
    public IdentityResult validatePassword(UserIdentity user, String password) {
        List<IdentityError> errors = new ArrayList<>();
        for (PasswordValidator validator : passwordValidators) {
            IdentityResult result = validator.validate(user, password);
            if (!result.succeeded()) {
                errors.addAll(result.errors());
            }
        }
        return errors.isEmpty() ? IdentityResult.success() : IdentityResult.failed(errors);
    }

    public String adminUserName() {
        return adminUserName;
    }

    private static boolean isSameUser(UserIdentity user, Long expectedUserId) {
        return Objects.equals(user.id(), expectedUserId);
    }
}
