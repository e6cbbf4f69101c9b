package com.dealengine.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Utility class for deriving and validating idempotency keys.
 *
 * Keys are deterministic: identical inputs always give an identical key and
 * changing any input component changes the key. Each input component is
 * length-prefixed before hashing, so a delimiter inside a value cannot make
 * two different input tuples hash to the same content.
 *
 * Key schema: {@code <namespace>:<body>}, where body is 32 hex characters of
 * SHA-256 for derived keys, or the evidence hash itself for evidence keys.
 */
public final class IdempotencyKeys {

    private static final int DERIVED_KEY_HEX_LENGTH = 32;
    private static final int SIGNATURE_HEX_LENGTH = 16;
    private static final Pattern KEY_FORMAT = Pattern.compile("^[a-z]+:[a-zA-Z0-9_-]{1,255}$");
    private static final Pattern SHA256_HEX = Pattern.compile("^[a-f0-9]{64}$");

    private IdempotencyKeys() {
    }

    /**
     * Key for activating a deal because of a game.
     */
    public static String keyFor(String dealId, String gameId, String conditionSignature) {
        requireComponent("dealId", dealId);
        requireComponent("gameId", gameId);
        requireComponent("conditionSignature", conditionSignature);
        return derive(KeyNamespace.ACTIVATION, dealId, gameId, conditionSignature);
    }

    /**
     * Key for storing a piece of evidence. The {@code evidence:} prefix is a
     * stable contract for callers that build evidence keys themselves.
     */
    public static String keyFor(String evidenceHash) {
        requireComponent("evidenceHash", evidenceHash);
        String normalized = evidenceHash.toLowerCase();
        if (!SHA256_HEX.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Evidence hash must be 64 hex characters: " + evidenceHash);
        }
        return KeyNamespace.EVIDENCE.qualify(normalized);
    }

    /**
     * Key for delivering one activation to one recipient on one channel.
     */
    public static String notificationKey(String activationKey, String recipientId, String channel) {
        requireComponent("activationKey", activationKey);
        requireComponent("recipientId", recipientId);
        requireComponent("channel", channel);
        return derive(KeyNamespace.NOTIFICATION, activationKey, recipientId, channel.toLowerCase());
    }

    /**
     * Short stable fingerprint of a normalized condition source.
     */
    public static String conditionSignature(String normalizedSource) {
        return sha256Hex(normalizedSource == null ? "" : normalizedSource).substring(0, SIGNATURE_HEX_LENGTH);
    }

    /**
     * Full SHA-256 hex digest of a string.
     */
    public static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean isValid(String key) {
        if (key == null || key.trim().isEmpty()) {
            return false;
        }
        return KEY_FORMAT.matcher(key).matches();
    }

    public static void validate(String key) {
        if (!isValid(key)) {
            throw new IllegalArgumentException("Invalid idempotency key: " + key);
        }
    }

    private static String derive(KeyNamespace namespace, String... components) {
        StringBuilder content = new StringBuilder(namespace.getPrefix());
        for (String component : components) {
            content.append('|').append(component.length()).append('#').append(component);
        }
        return namespace.qualify(sha256Hex(content.toString()).substring(0, DERIVED_KEY_HEX_LENGTH));
    }

    private static void requireComponent(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
