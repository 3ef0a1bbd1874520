package com.tessera.specification;

/**
 * Base class for specifications built from two child specifications.
 *
 * <p>The composite owns its children. Both must be non-null at construction.
 *
 * @param <T> the candidate type
 */
public abstract class CompositeSpecification<T> implements Specification<T> {

    private final Specification<T> left;
    private final Specification<T> right;

    /**
     * Creates a composite of two specifications.
     *
     * @param left  the first specification
     * @param right the second specification
     * @throws IllegalArgumentException if either child is null
     */
    protected CompositeSpecification(Specification<T> left, Specification<T> right) {
        if (left == null) {
            throw new IllegalArgumentException("left specification must not be null");
        }
        if (right == null) {
            throw new IllegalArgumentException("right specification must not be null");
        }
        this.left = left;
        this.right = right;
    }

    /** The first child specification. */
    public Specification<T> left() {
        return left;
    }

    /** The second child specification. */
    public Specification<T> right() {
        return right;
    }
}
