package com.tessera.identity;

import java.util.List;

/**
 * Outcome of an identity operation such as a role change or a validator run.
 *
 * @param succeeded whether the operation succeeded
 * @param errors    every error collected (empty when succeeded)
 */
public record IdentityResult(boolean succeeded, List<IdentityError> errors) {

    private static final IdentityResult SUCCESS = new IdentityResult(true, List.of());

    public IdentityResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** A successful result. */
    public static IdentityResult success() {
        return SUCCESS;
    }

    /** A failed result carrying the given errors. */
    public static IdentityResult failed(IdentityError... errors) {
        return new IdentityResult(false, List.of(errors));
    }

    /** A failed result carrying the given errors. */
    public static IdentityResult failed(List<IdentityError> errors) {
        return new IdentityResult(false, errors);
    }
}
