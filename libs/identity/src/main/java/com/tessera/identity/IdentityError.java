package com.tessera.identity;

/**
 * A single error reported inside an {@link IdentityResult}.
 *
 * @param code        stable machine-readable code (e.g., "PasswordTooShort")
 * @param description human-readable description
 */
public record IdentityError(String code, String description) {}
