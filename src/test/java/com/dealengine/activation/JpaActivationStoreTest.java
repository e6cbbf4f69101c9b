package com.dealengine.activation;

import com.dealengine.common.IdempotencyKeys;
import com.dealengine.common.exception.InvalidActivationStateException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for JpaActivationStore against H2.
 *
 * Not transactional: every store call commits in its own transaction, which
 * is what the unique constraint relies on.
 */
@SpringBootTest
@ActiveProfiles("test")
class JpaActivationStoreTest {

    private static final Instant NOW = Instant.parse("2026-04-01T20:00:00Z");
    private static final Duration TTL = Duration.ofHours(24);

    @Autowired
    private ActivationStore store;

    @Autowired
    private ActivationRepository activationRepository;

    @AfterEach
    void tearDown() {
        store.reset();
    }

    private static String key(String dealId, String gameId) {
        return IdempotencyKeys.keyFor(dealId, gameId, "sig0000000000000");
    }

    @Test
    void testJpaStoreIsDefault() {
        assertTrue(store instanceof JpaActivationStore);
    }

    @Test
    void testInsertIfAbsent() {
        String key = key("deal-1", "game-42");

        ActivationResult first = store.tryActivate(key, "deal-1", "game-42", NOW, TTL, "system");
        ActivationResult second = store.tryActivate(key, "deal-1", "game-42", NOW.plusSeconds(1), TTL, "system");

        assertTrue(first.isCreated());
        assertFalse(second.isCreated());
        assertEquals(NOW, second.getActivation().getTriggeredAt());
        assertEquals(1, activationRepository.count());
    }

    @Test
    void testSamePairDifferentKeyStillHandled() {
        store.tryActivate(key("deal-1", "game-42"), "deal-1", "game-42", NOW, TTL, "system");

        ActivationResult other = store.tryActivate("activation:differentsignature", "deal-1", "game-42", NOW, TTL, "system");

        assertFalse(other.isCreated());
        assertEquals(key("deal-1", "game-42"), other.getActivation().getActivationKey());
        assertEquals(1, activationRepository.count());
    }

    @Test
    void testConcurrentActivationCreatesExactlyOnce() throws Exception {
        String key = key("deal-1", "game-42");
        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ActivationResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return store.tryActivate(key, "deal-1", "game-42", NOW, TTL, "system");
                }));
            }
            start.countDown();

            int created = 0;
            for (Future<ActivationResult> future : futures) {
                ActivationResult result = future.get(30, TimeUnit.SECONDS);
                if (result.isCreated()) {
                    created++;
                }
                assertEquals(key, result.getActivation().getActivationKey());
            }
            assertEquals(1, created);
            assertEquals(1, activationRepository.count());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testTransitionPersists() {
        String key = key("deal-1", "game-42");
        store.tryActivate(key, "deal-1", "game-42", NOW, TTL, "system");

        store.transition(key, ActivationStatus.REVERSED, NOW.plusSeconds(30), "admin-1", "bad feed");

        Activation reloaded = store.findByKey(key).orElseThrow();
        assertEquals(ActivationStatus.REVERSED, reloaded.getStatus());
        assertEquals("bad feed", reloaded.getReversalReason());
        assertThrows(InvalidActivationStateException.class,
            () -> store.transition(key, ActivationStatus.EXPIRED, NOW.plus(Duration.ofDays(2)), "system", null));
    }

    @Test
    void testActiveAndDueQueries() {
        store.tryActivate(key("deal-1", "game-42"), "deal-1", "game-42", NOW, Duration.ofHours(1), "system");
        store.tryActivate(key("deal-2", "game-42"), "deal-2", "game-42", NOW, TTL, "system");

        Instant later = NOW.plus(Duration.ofHours(2));
        assertEquals(1, store.findActive(later).size());
        assertEquals(1, store.findDueForExpiry(later).size());
        assertEquals(2, store.findByGame("game-42").size());
        assertTrue(store.findByDealAndGame("deal-3", "game-42").isEmpty());
    }
}
