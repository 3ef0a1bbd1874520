package com.tessera.specification;

import java.util.function.Predicate;

/**
 * Satisfied when either of the child specifications is satisfied.
 *
 * <p>The right child is not evaluated when the left one already holds.
 *
 * @param <T> the candidate type
 */
public class OrSpecification<T> extends CompositeSpecification<T> {

    public OrSpecification(Specification<T> left, Specification<T> right) {
        super(left, right);
    }

    @Override
    public Predicate<T> toExpression() {
        Predicate<T> leftExpression = left().toExpression();
        Predicate<T> rightExpression = right().toExpression();
        return candidate -> leftExpression.test(candidate) || rightExpression.test(candidate);
    }
}
