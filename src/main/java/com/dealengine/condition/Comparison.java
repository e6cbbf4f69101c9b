package com.dealengine.condition;

import lombok.NonNull;
import lombok.Value;

/**
 * Compares one named game fact against an integer threshold.
 */
@Value
public class Comparison implements Predicate {

    @NonNull
    String fact;

    @NonNull
    ComparisonOperator operator;

    int threshold;

    @Override
    public String describe() {
        return fact + " " + operator.getSymbol() + " " + threshold;
    }
}
