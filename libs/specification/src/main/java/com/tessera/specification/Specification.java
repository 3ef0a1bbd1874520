package com.tessera.specification;

import java.util.function.Predicate;

/**
 * A composable predicate over candidates of type {@code T}.
 *
 * <p>A specification can be applied directly to a candidate with {@link #isSatisfiedBy(Object)} or
 * translated to a {@link Predicate} with {@link #toExpression()} so that a query layer can use it
 * as a filter. Both paths must agree: for any candidate, {@code isSatisfiedBy(c)} equals {@code
 * toExpression().test(c)}.
 *
 * <p>Composition builds a tree. Nothing is evaluated until the tree is translated or applied.
 *
 * @param <T> the candidate type
 */
public interface Specification<T> {

    /**
     * Returns the boolean expression represented by this specification.
     *
     * @return a side-effect free predicate
     */
    Predicate<T> toExpression();

    /**
     * Checks whether the given candidate satisfies this specification.
     *
     * @param candidate the object to test
     * @return the result of evaluating {@link #toExpression()} against the candidate
     */
    default boolean isSatisfiedBy(T candidate) {
        return toExpression().test(candidate);
    }

    /** Combines this specification with another one using logical AND. */
    default Specification<T> and(Specification<T> other) {
        return new AndSpecification<>(this, other);
    }

    /** Combines this specification with another one using logical OR. */
    default Specification<T> or(Specification<T> other) {
        return new OrSpecification<>(this, other);
    }

    /** Combines this specification with the negation of another one. */
    default Specification<T> andNot(Specification<T> other) {
        return new AndSpecification<>(this, new NotSpecification<>(other));
    }

    /** Negates this specification. */
    default Specification<T> not() {
        return new NotSpecification<>(this);
    }
}
