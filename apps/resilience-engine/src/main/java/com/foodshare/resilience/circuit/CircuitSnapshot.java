package com.foodshare.resilience.circuit;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime state of one circuit, as plain data. Owned by the caller between evaluations.
 *
 * @param failureTimestamps    failure times (epoch ms) inside the window, closed state only
 * @param consecutiveSuccesses successful probes since entering half-open
 * @param openedAtMs           when the circuit last opened, null unless open
 * @param halfOpenRequests     half-open evaluations so far, drives probe admission
 * @param config               breaker tuning the state was last evaluated with
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CircuitSnapshot(
    CircuitState state,
    List<Long> failureTimestamps,
    int consecutiveSuccesses,
    @Nullable Long openedAtMs,
    int halfOpenRequests,
    @Nullable CircuitBreakerConfig config
) {
    public CircuitSnapshot {
        state = state == null ? CircuitState.CLOSED : state;
        failureTimestamps = failureTimestamps == null ? List.of() : List.copyOf(failureTimestamps);
    }

    public static CircuitSnapshot closed(@Nullable CircuitBreakerConfig config) {
        return new CircuitSnapshot(CircuitState.CLOSED, List.of(), 0, null, 0, config);
    }

    public static CircuitSnapshot opened(long nowMs, @Nullable CircuitBreakerConfig config) {
        return new CircuitSnapshot(CircuitState.OPEN, List.of(), 0, nowMs, 0, config);
    }

    static CircuitSnapshot halfOpen(@Nullable CircuitBreakerConfig config) {
        return new CircuitSnapshot(CircuitState.HALF_OPEN, List.of(), 0, null, 0, config);
    }

    CircuitSnapshot withFailures(List<Long> failures) {
        return new CircuitSnapshot(state, failures, consecutiveSuccesses, openedAtMs, halfOpenRequests, config);
    }

    CircuitSnapshot withFailureAt(long nowMs) {
        List<Long> failures = new ArrayList<>(failureTimestamps);
        failures.add(nowMs);
        return withFailures(failures);
    }

    CircuitSnapshot withConsecutiveSuccesses(int successes) {
        return new CircuitSnapshot(state, failureTimestamps, successes, openedAtMs, halfOpenRequests, config);
    }

    CircuitSnapshot withHalfOpenRequests(int requests) {
        return new CircuitSnapshot(state, failureTimestamps, consecutiveSuccesses, openedAtMs, requests, config);
    }

    CircuitSnapshot withConfig(CircuitBreakerConfig newConfig) {
        return new CircuitSnapshot(state, failureTimestamps, consecutiveSuccesses, openedAtMs, halfOpenRequests,
                newConfig);
    }
}
