package com.tessera.specification;

import java.util.function.Predicate;

/**
 * Satisfied when the wrapped specification is not.
 *
 * @param <T> the candidate type
 */
public class NotSpecification<T> implements Specification<T> {

    private final Specification<T> specification;

    /**
     * @param specification the specification to negate
     * @throws IllegalArgumentException if the specification is null
     */
    public NotSpecification(Specification<T> specification) {
        if (specification == null) {
            throw new IllegalArgumentException("specification must not be null");
        }
        this.specification = specification;
    }

    /** The negated specification. */
    public Specification<T> specification() {
        return specification;
    }

    @Override
    public Predicate<T> toExpression() {
        Predicate<T> expression = specification.toExpression();
        return candidate -> !expression.test(candidate);
    }
}
