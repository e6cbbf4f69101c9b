package com.dealengine.deal;

/**
 * Publication state of a deal. Owned by the approval workflow.
 */
public enum DealStatus {
    /**
     * Deal is being authored and is never evaluated.
     */
    DRAFT,

    /**
     * Deal is approved and evaluated against completed games.
     */
    PUBLISHED,

    /**
     * Deal is no longer offered.
     */
    RETIRED
}
