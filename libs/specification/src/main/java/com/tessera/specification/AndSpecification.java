package com.tessera.specification;

import java.util.function.Predicate;

/**
 * Satisfied only when both child specifications are satisfied.
 *
 * <p>The right child is not evaluated when the left one already fails.
 *
 * @param <T> the candidate type
 */
public class AndSpecification<T> extends CompositeSpecification<T> {

    public AndSpecification(Specification<T> left, Specification<T> right) {
        super(left, right);
    }

    @Override
    public Predicate<T> toExpression() {
        Predicate<T> leftExpression = left().toExpression();
        Predicate<T> rightExpression = right().toExpression();
        return candidate -> leftExpression.test(candidate) && rightExpression.test(candidate);
    }
}
