package com.foodshare.resilience.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-key owner of circuit snapshots (key = RPC function name or host).
 *
 * Each key's read-modify-write runs inside {@link ConcurrentHashMap#compute}, which serializes
 * updates to the same key while different keys never contend. Snapshots are created lazily
 * and live until {@link #reset(String)} or {@link #resetAll()}.
 */
public class CircuitBreakerStore {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerStore.class);

    /**
     * Notified after a key changes state, outside the key's critical section.
     */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String key, CircuitState from, CircuitState to);
    }

    private final ConcurrentHashMap<String, CircuitSnapshot> circuits = new ConcurrentHashMap<>();
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final CircuitBreakerEvaluator evaluator;
    private final Clock clock;

    public CircuitBreakerStore(CircuitBreakerEvaluator evaluator, Clock clock) {
        this.evaluator = evaluator;
        this.clock = clock;
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    /**
     * Pre-flight check for one request against {@code key}'s circuit.
     */
    public CircuitBreakerDecision tryAcquire(String key, CircuitBreakerConfig config) {
        long now = clock.millis();
        CircuitState[] before = new CircuitState[1];
        CircuitBreakerDecision[] decision = new CircuitBreakerDecision[1];

        circuits.compute(key, (k, current) -> {
            before[0] = current == null ? CircuitState.CLOSED : current.state();
            decision[0] = evaluator.evaluate(current, config, now);
            return decision[0].snapshot();
        });

        publish(key, before[0], decision[0].state());
        return decision[0];
    }

    /**
     * Record the outcome of a request admitted by {@link #tryAcquire}.
     *
     * @return the circuit state after recording
     */
    public CircuitState recordResult(String key, CircuitBreakerConfig config, boolean success) {
        long now = clock.millis();
        CircuitState[] before = new CircuitState[1];

        CircuitSnapshot next = circuits.compute(key, (k, current) -> {
            before[0] = current == null ? CircuitState.CLOSED : current.state();
            return success
                    ? evaluator.recordSuccess(current, config, now)
                    : evaluator.recordFailure(current, config, now);
        });

        publish(key, before[0], next.state());
        return next.state();
    }

    public Optional<CircuitSnapshot> snapshot(String key) {
        return Optional.ofNullable(circuits.get(key));
    }

    public CircuitState state(String key) {
        return snapshot(key).map(CircuitSnapshot::state).orElse(CircuitState.CLOSED);
    }

    /**
     * Current snapshots sorted by key.
     */
    public Map<String, CircuitSnapshot> snapshots() {
        return new TreeMap<>(circuits);
    }

    /**
     * Open {@code key}'s circuit now, for manual intervention.
     */
    public void forceOpen(String key, CircuitBreakerConfig config) {
        logger.warn("Circuit {} manually opened", key);
        CircuitSnapshot previous = circuits.put(key, CircuitSnapshot.opened(clock.millis(), config));
        publish(key, previous == null ? CircuitState.CLOSED : previous.state(), CircuitState.OPEN);
    }

    public void forceClose(String key) {
        logger.info("Circuit {} manually closed", key);
        reset(key);
    }

    public void reset(String key) {
        CircuitSnapshot previous = circuits.remove(key);
        if (previous != null) {
            publish(key, previous.state(), CircuitState.CLOSED);
        }
    }

    public void resetAll() {
        for (String key : circuits.keySet()) {
            reset(key);
        }
        logger.info("All circuits reset");
    }

    private void publish(String key, CircuitState from, CircuitState to) {
        if (from == to) {
            return;
        }
        logger.info("Circuit {} state {} -> {}", key, from.value(), to.value());
        for (TransitionListener listener : listeners) {
            listener.onTransition(key, from, to);
        }
    }
}
