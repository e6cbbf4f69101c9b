package com.dealengine.condition;

import lombok.Value;

/**
 * An authored trigger condition together with its compiled predicate.
 */
@Value
public class Condition {

    /**
     * Lower-cased, whitespace-collapsed source; the cache key.
     */
    String normalizedSource;

    /**
     * Stable fingerprint of the normalized source, part of every activation key.
     */
    String signature;

    Predicate predicate;
}
