package com.foodshare.resilience.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stateless circuit breaker: every operation takes the current {@link CircuitSnapshot} and
 * returns the next one. The caller owns persistence, one snapshot per key.
 *
 * State machine:
 *   CLOSED (normal) → OPEN (shedding) → HALF_OPEN (probing) → CLOSED or OPEN
 *
 * - CLOSED: allowed. Failures inside the rolling window are counted; reaching
 *   failureThreshold opens the circuit.
 * - OPEN: denied with the remaining wait until resetTimeout has elapsed since opening;
 *   the first evaluation after that moves to HALF_OPEN before deciding.
 * - HALF_OPEN: halfOpenRequestPercentage of evaluations are admitted as probes.
 *   successThreshold consecutive successes close the circuit, any failure reopens it.
 *
 * Missing or unreadable state is a fresh CLOSED circuit: availability wins over protection.
 */
public class CircuitBreakerEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerEvaluator.class);

    private final Clock clock;
    private final CircuitSnapshotCodec codec;

    public CircuitBreakerEvaluator(Clock clock, CircuitSnapshotCodec codec) {
        this.clock = clock;
        this.codec = codec;
    }

    /**
     * Get circuit breaker configuration for a preset ("default", "sensitive", "tolerant").
     */
    public CircuitBreakerConfig getCircuitBreakerConfig(@Nullable String preset) {
        return CircuitBreakerConfig.forPreset(preset);
    }

    /**
     * Evaluate serialized state at the current time, using the configuration embedded in the
     * state or the default preset.
     *
     * The decision carries the serialized next state in {@link CircuitBreakerDecision#nextState()};
     * callers persist it in place of the state they passed in.
     */
    public CircuitBreakerDecision evaluateCircuitState(@Nullable String serializedState) {
        CircuitSnapshot snapshot = codec.decode(serializedState).orElse(null);
        CircuitBreakerDecision decision = evaluate(snapshot, configOf(snapshot), clock.millis());
        return decision.withNextState(codec.encode(decision.snapshot()));
    }

    /**
     * Record the result of a request against serialized state and return the next serialized state.
     */
    public String recordResult(@Nullable String serializedState, boolean success) {
        CircuitSnapshot snapshot = codec.decode(serializedState).orElse(null);
        CircuitBreakerConfig config = configOf(snapshot);
        long now = clock.millis();
        CircuitSnapshot next = success
                ? recordSuccess(snapshot, config, now)
                : recordFailure(snapshot, config, now);
        return codec.encode(next);
    }

    public String serialize(CircuitSnapshot snapshot) {
        return codec.encode(snapshot);
    }

    public CircuitBreakerDecision evaluate(@Nullable CircuitSnapshot snapshot, CircuitBreakerConfig config,
                                           long nowMs) {
        CircuitSnapshot current = advance(snapshot, config, nowMs);

        switch (current.state()) {
            case CLOSED:
                return new CircuitBreakerDecision(true, CircuitState.CLOSED, null, "circuit closed",
                        pruneFailures(current, config, nowMs));
            case OPEN:
                long remaining = remainingOpenMs(current, config, nowMs);
                return new CircuitBreakerDecision(false, CircuitState.OPEN, remaining,
                        "circuit open, retry in " + remaining + "ms", current);
            case HALF_OPEN:
            default:
                return admitProbe(current, config);
        }
    }

    public CircuitSnapshot recordSuccess(@Nullable CircuitSnapshot snapshot, CircuitBreakerConfig config,
                                         long nowMs) {
        CircuitSnapshot current = advance(snapshot, config, nowMs);

        switch (current.state()) {
            case HALF_OPEN:
                int successes = current.consecutiveSuccesses() + 1;
                if (successes >= config.successThreshold()) {
                    logger.debug("{} consecutive probe successes: halfOpen -> closed", successes);
                    return CircuitSnapshot.closed(config);
                }
                return current.withConsecutiveSuccesses(successes);
            case CLOSED:
                return pruneFailures(current, config, nowMs);
            case OPEN:
            default:
                // Late result of a request admitted before the circuit opened; the reset timeout
                // has not elapsed yet
                return current;
        }
    }

    public CircuitSnapshot recordFailure(@Nullable CircuitSnapshot snapshot, CircuitBreakerConfig config,
                                         long nowMs) {
        CircuitSnapshot current = advance(snapshot, config, nowMs);

        switch (current.state()) {
            case CLOSED:
                CircuitSnapshot counted = pruneFailures(current, config, nowMs).withFailureAt(nowMs);
                if (counted.failureTimestamps().size() >= config.failureThreshold()) {
                    logger.debug("Failure threshold {} reached: closed -> open", config.failureThreshold());
                    return CircuitSnapshot.opened(nowMs, config);
                }
                return counted;
            case HALF_OPEN:
                logger.debug("Probe failed: halfOpen -> open");
                return CircuitSnapshot.opened(nowMs, config);
            case OPEN:
            default:
                return current;
        }
    }

    /**
     * Apply {@code config} and the time-based open -> halfOpen step, so that evaluations and
     * recorded results agree on the state even when the caller did not persist the last decision.
     */
    private static CircuitSnapshot advance(@Nullable CircuitSnapshot snapshot, CircuitBreakerConfig config,
                                           long nowMs) {
        CircuitSnapshot current = snapshot == null ? CircuitSnapshot.closed(config) : snapshot.withConfig(config);
        if (current.state() == CircuitState.OPEN && remainingOpenMs(current, config, nowMs) == 0) {
            logger.debug("Reset timeout elapsed: open -> halfOpen");
            return CircuitSnapshot.halfOpen(config);
        }
        return current;
    }

    private CircuitBreakerDecision admitProbe(CircuitSnapshot halfOpen, CircuitBreakerConfig config) {
        int n = halfOpen.halfOpenRequests();
        CircuitSnapshot next = halfOpen.withHalfOpenRequests(n + 1);
        if (isProbeAdmitted(n, config.halfOpenRequestPercentage())) {
            return new CircuitBreakerDecision(true, CircuitState.HALF_OPEN, null, "half-open probe admitted", next);
        }
        return new CircuitBreakerDecision(false, CircuitState.HALF_OPEN, null, "half-open probe quota reached", next);
    }

    /**
     * The n-th half-open evaluation (0-based) is admitted when ceil((n+1)p/100) > ceil(np/100),
     * so the first probe always goes through and p percent of evaluations are admitted overall.
     */
    static boolean isProbeAdmitted(int n, int percentage) {
        long p = Math.max(1, Math.min(100, percentage));
        return ceilDiv((n + 1L) * p, 100) > ceilDiv(n * p, 100);
    }

    private static long ceilDiv(long x, long y) {
        return -Math.floorDiv(-x, y);
    }

    private static long remainingOpenMs(CircuitSnapshot open, CircuitBreakerConfig config, long nowMs) {
        if (open.openedAtMs() == null) {
            return 0;
        }
        long elapsed = nowMs - open.openedAtMs();
        return Math.max(0, config.resetTimeoutMs() - elapsed);
    }

    private static CircuitSnapshot pruneFailures(CircuitSnapshot closed, CircuitBreakerConfig config, long nowMs) {
        long cutoff = nowMs - config.failureWindowMs();
        List<Long> recent = closed.failureTimestamps().stream()
                .filter(ts -> ts > cutoff)
                .collect(Collectors.toList());
        return recent.size() == closed.failureTimestamps().size() ? closed : closed.withFailures(recent);
    }

    private static CircuitBreakerConfig configOf(@Nullable CircuitSnapshot snapshot) {
        return snapshot != null && snapshot.config() != null ? snapshot.config() : CircuitBreakerConfig.DEFAULT;
    }
}
