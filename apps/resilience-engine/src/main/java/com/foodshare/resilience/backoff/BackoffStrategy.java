package com.foodshare.resilience.backoff;

import org.springframework.lang.Nullable;

/**
 * Backoff strategies. The wire names are shared with the mobile clients and must not change.
 */
public enum BackoffStrategy {
    CONSTANT("constant"),
    LINEAR("linear"),
    EXPONENTIAL("exponential"),
    EXPONENTIAL_WITH_JITTER("exponentialWithJitter"),
    FULL_JITTER("fullJitter"),
    EQUAL_JITTER("equalJitter");

    private final String value;

    BackoffStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve a wire name, falling back to {@link #EXPONENTIAL_WITH_JITTER}.
     */
    public static BackoffStrategy fromValue(@Nullable String value) {
        if (value != null) {
            for (BackoffStrategy strategy : values()) {
                if (strategy.value.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                    return strategy;
                }
            }
        }
        return EXPONENTIAL_WITH_JITTER;
    }
}
