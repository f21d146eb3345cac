package com.foodshare.resilience.circuit;

import org.springframework.lang.Nullable;

/**
 * Circuit breaker tuning.
 *
 * @param failureThreshold          failures within the window that open the circuit
 * @param successThreshold          consecutive half-open successes that close it again
 * @param resetTimeoutSeconds       time an open circuit waits before probing
 * @param failureWindowSeconds      rolling window for counting failures while closed
 * @param halfOpenRequestPercentage share of half-open evaluations admitted as probes
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    int successThreshold,
    double resetTimeoutSeconds,
    double failureWindowSeconds,
    int halfOpenRequestPercentage
) {
    public static final CircuitBreakerConfig DEFAULT = new CircuitBreakerConfig(5, 3, 30, 60, 50);
    public static final CircuitBreakerConfig SENSITIVE = new CircuitBreakerConfig(3, 5, 60, 30, 25);
    public static final CircuitBreakerConfig TOLERANT = new CircuitBreakerConfig(10, 2, 15, 120, 75);

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1: " + successThreshold);
        }
        if (resetTimeoutSeconds < 0 || failureWindowSeconds <= 0) {
            throw new IllegalArgumentException("Invalid timing: resetTimeoutSeconds=" + resetTimeoutSeconds
                    + ", failureWindowSeconds=" + failureWindowSeconds);
        }
    }

    /**
     * Preset lookup: "default", "sensitive" or "tolerant"; anything else is "default".
     */
    public static CircuitBreakerConfig forPreset(@Nullable String preset) {
        if (preset == null) {
            return DEFAULT;
        }
        return switch (preset.toLowerCase()) {
            case "sensitive" -> SENSITIVE;
            case "tolerant" -> TOLERANT;
            default -> DEFAULT;
        };
    }

    public long resetTimeoutMs() {
        return Math.round(resetTimeoutSeconds * 1000);
    }

    public long failureWindowMs() {
        return Math.round(failureWindowSeconds * 1000);
    }

    public CircuitBreakerConfig withThresholds(int failures, double resetSeconds) {
        return new CircuitBreakerConfig(failures, successThreshold, resetSeconds, failureWindowSeconds,
                halfOpenRequestPercentage);
    }
}
