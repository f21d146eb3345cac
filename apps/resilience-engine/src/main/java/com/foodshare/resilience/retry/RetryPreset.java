package com.foodshare.resilience.retry;

import com.foodshare.resilience.backoff.BackoffStrategy;
import org.springframework.lang.Nullable;

/**
 * Named retry envelopes shared with the mobile clients.
 */
public enum RetryPreset {
    DEFAULT("default",
            new RetrySettings(3, BackoffStrategy.EXPONENTIAL_WITH_JITTER, 500, 30_000, false)),
    AGGRESSIVE("aggressive",
            new RetrySettings(5, BackoffStrategy.EXPONENTIAL_WITH_JITTER, 250, 60_000, true)),
    CONSERVATIVE("conservative",
            new RetrySettings(2, BackoffStrategy.EXPONENTIAL_WITH_JITTER, 1_000, 10_000, false)),
    NO_RETRY("noRetry",
            new RetrySettings(1, BackoffStrategy.CONSTANT, 0, 0, false)),
    RATE_LIMIT_AWARE("rateLimitAware",
            new RetrySettings(4, BackoffStrategy.EQUAL_JITTER, 1_000, 60_000, false));

    private final String value;
    private final RetrySettings settings;

    RetryPreset(String value, RetrySettings settings) {
        this.value = value;
        this.settings = settings;
    }

    public String value() {
        return value;
    }

    public RetrySettings settings() {
        return settings;
    }

    /**
     * Resolve a preset name, falling back to {@link #DEFAULT}.
     */
    public static RetryPreset fromValue(@Nullable String value) {
        if (value != null) {
            for (RetryPreset preset : values()) {
                if (preset.value.equalsIgnoreCase(value)) {
                    return preset;
                }
            }
        }
        return DEFAULT;
    }
}
