package com.dealengine.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IdempotencyKeys.
 */
class IdempotencyKeysTest {

    private static final String HASH_A = IdempotencyKeys.sha256Hex("evidence-a");
    private static final String HASH_B = IdempotencyKeys.sha256Hex("evidence-b");

    @Test
    void testActivationKey_IsDeterministic() {
        String first = IdempotencyKeys.keyFor("deal-1", "game-42", "abc123");
        String second = IdempotencyKeys.keyFor("deal-1", "game-42", "abc123");

        assertEquals(first, second);
        assertTrue(first.startsWith("activation:"));
        assertEquals("activation:".length() + 32, first.length());
        assertTrue(IdempotencyKeys.isValid(first));
    }

    @Test
    void testActivationKey_ChangesWithEveryComponent() {
        String base = IdempotencyKeys.keyFor("deal-1", "game-42", "abc123");

        assertNotEquals(base, IdempotencyKeys.keyFor("deal-2", "game-42", "abc123"));
        assertNotEquals(base, IdempotencyKeys.keyFor("deal-1", "game-43", "abc123"));
        assertNotEquals(base, IdempotencyKeys.keyFor("deal-1", "game-42", "abc124"));
    }

    @Test
    void testActivationKey_DelimiterInsideValueDoesNotCollide() {
        String split = IdempotencyKeys.keyFor("deal|1", "game", "sig");
        String joined = IdempotencyKeys.keyFor("deal", "1|game", "sig");

        assertNotEquals(split, joined);
    }

    @Test
    void testEvidenceKey_StableAcrossCalls() {
        String first = IdempotencyKeys.keyFor(HASH_A);
        String second = IdempotencyKeys.keyFor(HASH_A);

        assertEquals(first, second);
        assertEquals("evidence:" + HASH_A, first);
        assertNotEquals(first, IdempotencyKeys.keyFor(HASH_B));
    }

    @Test
    void testEvidenceKey_NormalizesCase() {
        assertEquals(IdempotencyKeys.keyFor(HASH_A), IdempotencyKeys.keyFor(HASH_A.toUpperCase()));
    }

    @Test
    void testEvidenceKey_RejectsNonHash() {
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKeys.keyFor("not-a-hash"));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKeys.keyFor(" "));
    }

    @Test
    void testNamespacesNeverOverlap() {
        String activation = IdempotencyKeys.keyFor("deal-1", "game-42", "abc123");
        String notification = IdempotencyKeys.notificationKey(activation, "user-7", "EMAIL");

        assertTrue(KeyNamespace.ACTIVATION.owns(activation));
        assertTrue(KeyNamespace.NOTIFICATION.owns(notification));
        assertFalse(KeyNamespace.ACTIVATION.owns(notification));
        assertTrue(KeyNamespace.EVIDENCE.owns(IdempotencyKeys.keyFor(HASH_A)));
    }

    @Test
    void testNotificationKey_ChannelIsCaseInsensitive() {
        String activation = IdempotencyKeys.keyFor("deal-1", "game-42", "abc123");

        assertEquals(
            IdempotencyKeys.notificationKey(activation, "user-7", "email"),
            IdempotencyKeys.notificationKey(activation, "user-7", "EMAIL"));
        assertNotEquals(
            IdempotencyKeys.notificationKey(activation, "user-7", "email"),
            IdempotencyKeys.notificationKey(activation, "user-7", "sms"));
    }

    @Test
    void testBlankComponentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKeys.keyFor("", "game-42", "abc"));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKeys.keyFor("deal-1", null, "abc"));
    }

    @Test
    void testValidate() {
        assertTrue(IdempotencyKeys.isValid("activation:0123abcd"));
        assertFalse(IdempotencyKeys.isValid("no-namespace"));
        assertFalse(IdempotencyKeys.isValid("Activation:abc"));
        assertFalse(IdempotencyKeys.isValid("activation:has space"));
        assertFalse(IdempotencyKeys.isValid(null));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyKeys.validate("bad key"));
    }

    @Test
    void testConditionSignature() {
        String signature = IdempotencyKeys.conditionSignature("home win");

        assertEquals(16, signature.length());
        assertEquals(signature, IdempotencyKeys.conditionSignature("home win"));
        assertNotEquals(signature, IdempotencyKeys.conditionSignature("away win"));
    }
}
