/**
 * Composable boolean specifications.
 *
 * <p>Leaf specifications wrap predicates; {@link com.tessera.specification.AndSpecification},
 * {@link com.tessera.specification.OrSpecification} and
 * {@link com.tessera.specification.NotSpecification} combine them into trees that translate to a
 * single {@link java.util.function.Predicate}.
 */
package com.tessera.specification;
