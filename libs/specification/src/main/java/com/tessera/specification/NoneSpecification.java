package com.tessera.specification;

import java.util.function.Predicate;

/**
 * Specification satisfied by no candidate.
 *
 * @param <T> the candidate type
 */
public final class NoneSpecification<T> implements Specification<T> {

    @Override
    public Predicate<T> toExpression() {
        return candidate -> false;
    }
}
