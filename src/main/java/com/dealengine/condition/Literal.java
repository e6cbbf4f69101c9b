package com.dealengine.condition;

import lombok.Value;

/**
 * Constant truth value. A blank condition compiles to {@link #FALSE}.
 */
@Value
public class Literal implements Predicate {

    public static final Literal TRUE = new Literal(true);
    public static final Literal FALSE = new Literal(false);

    boolean value;

    @Override
    public String describe() {
        return String.valueOf(value);
    }
}
