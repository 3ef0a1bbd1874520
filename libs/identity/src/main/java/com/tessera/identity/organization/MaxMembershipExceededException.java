package com.tessera.identity.organization;

/**
 * Thrown when a user would belong to more organization units than the tenant allows.
 */
public class MaxMembershipExceededException extends RuntimeException {

    private final int maxCount;
    private final int requestedCount;

    public MaxMembershipExceededException(int maxCount, int requestedCount) {
        super("Can not set more than %d organization units for a user (requested %d)"
                .formatted(maxCount, requestedCount));
        this.maxCount = maxCount;
        this.requestedCount = requestedCount;
    }

    /** The configured limit. */
    public int maxCount() {
        return maxCount;
    }

    /** The membership count the operation would have produced. */
    public int requestedCount() {
        return requestedCount;
    }
}
