package com.foodshare.resilience.circuit;

import org.springframework.lang.Nullable;

/**
 * Pre-flight verdict for one request.
 *
 * @param waitTimeMs time until the open circuit may probe again, null when not applicable
 * @param snapshot   state to persist for the next evaluation
 * @param nextState  {@code snapshot} in serialized form, set by the serialized-state API only
 */
public record CircuitBreakerDecision(
    boolean allowed,
    CircuitState state,
    @Nullable Long waitTimeMs,
    String reason,
    CircuitSnapshot snapshot,
    @Nullable String nextState
) {
    public CircuitBreakerDecision(boolean allowed, CircuitState state, @Nullable Long waitTimeMs, String reason,
                                  CircuitSnapshot snapshot) {
        this(allowed, state, waitTimeMs, reason, snapshot, null);
    }

    CircuitBreakerDecision withNextState(String serialized) {
        return new CircuitBreakerDecision(allowed, state, waitTimeMs, reason, snapshot, serialized);
    }
}
