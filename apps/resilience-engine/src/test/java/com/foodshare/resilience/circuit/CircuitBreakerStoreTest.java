package com.foodshare.resilience.circuit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodshare.resilience.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerStoreTest {

    private static final CircuitBreakerConfig CONFIG = new CircuitBreakerConfig(3, 1, 10, 60, 100);

    private MutableClock clock;
    private CircuitBreakerStore store;
    private List<String> transitions;

    @BeforeEach
    void setup() {
        clock = new MutableClock(1_000_000L);
        store = new CircuitBreakerStore(
                new CircuitBreakerEvaluator(clock, new CircuitSnapshotCodec(new ObjectMapper())), clock);
        transitions = Collections.synchronizedList(new ArrayList<>());
        store.addListener((key, from, to) -> transitions.add(key + ":" + from.value() + "->" + to.value()));
    }

    @Test
    void testUnknownKey_Closed() {
        assertEquals(CircuitState.CLOSED, store.state("get_nearby_posts"));
        assertTrue(store.snapshot("get_nearby_posts").isEmpty());
        assertTrue(store.tryAcquire("get_nearby_posts", CONFIG).allowed());
        assertTrue(transitions.isEmpty());
    }

    @Test
    void testFullLifecycle_NotifiesTransitions() {
        for (int i = 0; i < 3; i++) {
            store.recordResult("sync_delta", CONFIG, false);
        }
        assertEquals(CircuitState.OPEN, store.state("sync_delta"));
        assertFalse(store.tryAcquire("sync_delta", CONFIG).allowed());

        clock.advance(10_000);
        CircuitBreakerDecision probe = store.tryAcquire("sync_delta", CONFIG);
        assertTrue(probe.allowed());
        assertEquals(CircuitState.HALF_OPEN, store.state("sync_delta"));

        assertEquals(CircuitState.CLOSED, store.recordResult("sync_delta", CONFIG, true));
        assertEquals(List.of("sync_delta:closed->open", "sync_delta:open->halfOpen", "sync_delta:halfOpen->closed"),
                transitions);
    }

    @Test
    void testKeysAreIndependent() {
        for (int i = 0; i < 3; i++) {
            store.recordResult("search_posts", CONFIG, false);
        }
        assertEquals(CircuitState.OPEN, store.state("search_posts"));
        assertTrue(store.tryAcquire("send_message", CONFIG).allowed());
    }

    @Test
    void testForceOpenAndClose() {
        store.forceOpen("sign_in", CONFIG);
        CircuitBreakerDecision denied = store.tryAcquire("sign_in", CONFIG);
        assertFalse(denied.allowed());
        assertEquals(10_000L, denied.waitTimeMs());

        store.forceClose("sign_in");
        assertTrue(store.tryAcquire("sign_in", CONFIG).allowed());
        assertEquals(List.of("sign_in:closed->open", "sign_in:open->closed"), transitions);
    }

    @Test
    void testResetAll() {
        store.forceOpen("a", CONFIG);
        store.forceOpen("b", CONFIG);
        assertEquals(List.of("a", "b"), new ArrayList<>(store.snapshots().keySet()));

        store.resetAll();
        assertTrue(store.snapshots().isEmpty());
        assertEquals(CircuitState.CLOSED, store.state("a"));
    }

    @Test
    void testConcurrentFailures_NoneLost() throws InterruptedException {
        CircuitBreakerConfig highThreshold = new CircuitBreakerConfig(10_000, 1, 10, 60, 100);
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.recordResult("shared", highThreshold, false);
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(threads * perThread, store.snapshot("shared").orElseThrow().failureTimestamps().size());
    }
}
