package com.tessera.specification;

import java.util.function.Predicate;

/**
 * Specification satisfied by every candidate.
 *
 * @param <T> the candidate type
 */
public final class AnySpecification<T> implements Specification<T> {

    @Override
    public Predicate<T> toExpression() {
        return candidate -> true;
    }
}
