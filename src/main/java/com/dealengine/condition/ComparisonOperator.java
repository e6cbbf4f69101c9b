package com.dealengine.condition;

import java.util.Arrays;
import java.util.Optional;

/**
 * Integer comparison operators usable in a trigger condition.
 */
public enum ComparisonOperator {
    GTE(">="),
    GT(">"),
    LTE("<="),
    LT("<"),
    EQ("=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(int actual, int threshold) {
        switch (this) {
            case GTE:
                return actual >= threshold;
            case GT:
                return actual > threshold;
            case LTE:
                return actual <= threshold;
            case LT:
                return actual < threshold;
            case EQ:
                return actual == threshold;
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        if ("==".equals(symbol)) {
            return Optional.of(EQ);
        }
        return Arrays.stream(values())
            .filter(op -> op.symbol.equals(symbol))
            .findFirst();
    }
}
