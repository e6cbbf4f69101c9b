package com.dealengine.activation;

import lombok.Value;

/**
 * Outcome of an insert-if-absent.
 *
 * {@code created=false} means the activation already existed: the caller must
 * treat the pair as already handled and perform no further side effect.
 */
@Value
public class ActivationResult {
    boolean created;
    Activation activation;

    public static ActivationResult created(Activation activation) {
        return new ActivationResult(true, activation);
    }

    public static ActivationResult existing(Activation activation) {
        return new ActivationResult(false, activation);
    }
}
