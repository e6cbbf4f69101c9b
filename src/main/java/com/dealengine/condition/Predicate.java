package com.dealengine.condition;

/**
 * Node of a compiled trigger condition.
 *
 * Implementations are immutable value objects: {@link Comparison},
 * {@link Conjunction}, {@link Disjunction} and {@link Literal}.
 */
public interface Predicate {

    /**
     * Canonical rendering of this node, stable for equal trees.
     */
    String describe();
}
