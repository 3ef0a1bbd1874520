package com.tessera.specification;

import java.util.function.Predicate;

/**
 * Leaf specification backed by a plain predicate.
 *
 * @param <T> the candidate type
 */
public class ExpressionSpecification<T> implements Specification<T> {

    private final Predicate<T> expression;

    /**
     * @param expression the predicate this specification represents
     * @throws IllegalArgumentException if the expression is null
     */
    public ExpressionSpecification(Predicate<T> expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        this.expression = expression;
    }

    @Override
    public Predicate<T> toExpression() {
        return expression;
    }
}
