package com.dealengine.common;

/**
 * Namespaces for idempotency keys.
 *
 * Every key starts with its namespace prefix, so keys minted for different
 * purposes can never collide even when their raw inputs coincide.
 */
public enum KeyNamespace {

    /**
     * Activation of a deal for a game.
     */
    ACTIVATION("activation"),

    /**
     * Content-addressed evidence snapshot.
     */
    EVIDENCE("evidence"),

    /**
     * Per-recipient, per-channel notification dispatch.
     */
    NOTIFICATION("notification");

    private final String prefix;

    KeyNamespace(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public String qualify(String body) {
        return prefix + ":" + body;
    }

    public boolean owns(String key) {
        return key != null && key.startsWith(prefix + ":");
    }
}
