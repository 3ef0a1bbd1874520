package com.tessera.specification;

import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Factory and helper methods for {@link Specification}.
 */
public final class Specifications {

    private Specifications() {
        // utility class
    }

    /** Wraps a predicate as a specification. */
    public static <T> Specification<T> of(Predicate<T> expression) {
        return new ExpressionSpecification<>(expression);
    }

    /** A specification every candidate satisfies. */
    public static <T> Specification<T> any() {
        return new AnySpecification<>();
    }

    /** A specification no candidate satisfies. */
    public static <T> Specification<T> none() {
        return new NoneSpecification<>();
    }

    /**
     * Returns the candidates that satisfy the specification, in iteration order.
     *
     * @param candidates    the candidates to filter
     * @param specification the filter
     * @return an immutable list of matching candidates
     */
    public static <T> List<T> filter(Collection<T> candidates, Specification<T> specification) {
        if (specification == null) {
            throw new IllegalArgumentException("specification must not be null");
        }
        Predicate<T> expression = specification.toExpression();
        return candidates.stream().filter(expression).toList();
    }
}
