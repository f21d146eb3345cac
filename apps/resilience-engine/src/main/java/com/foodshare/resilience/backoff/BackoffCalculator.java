package com.foodshare.resilience.backoff;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Maps (attempt, base delay, max delay, strategy) to the delay before the next attempt.
 *
 * Stateless apart from the random source, which is only read by the jittered strategies.
 * Safe to share across threads when the random source is (the default one is).
 */
public class BackoffCalculator {

    // 2^62 already exceeds any representable delay in ms
    private static final int MAX_EXPONENT = 62;

    private final DoubleSupplier random;

    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random uniform values in [0, 1)
     */
    public BackoffCalculator(DoubleSupplier random) {
        this.random = random;
    }

    /**
     * Calculate the delay before retry {@code attempt} (0-indexed).
     *
     * @return delay in milliseconds, within [0, maxDelayMs]
     * @throws IllegalArgumentException if baseDelayMs is negative or greater than maxDelayMs
     */
    public long calculateBackoff(int attempt, long baseDelayMs, long maxDelayMs, BackoffStrategy strategy) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "Invalid backoff bounds: baseDelayMs=" + baseDelayMs + ", maxDelayMs=" + maxDelayMs);
        }
        int n = Math.max(0, attempt);
        double exponential = Math.scalb((double) baseDelayMs, Math.min(n, MAX_EXPONENT));

        double delay = switch (strategy) {
            case CONSTANT -> baseDelayMs;
            case LINEAR -> (double) baseDelayMs * (n + 1);
            case EXPONENTIAL -> exponential;
            case EXPONENTIAL_WITH_JITTER -> exponential * (0.5 + random.getAsDouble());
            case FULL_JITTER -> random.getAsDouble() * exponential;
            case EQUAL_JITTER -> exponential / 2 + random.getAsDouble() * (exponential / 2);
        };

        return clamp(delay, maxDelayMs);
    }

    private static long clamp(double delay, long maxDelayMs) {
        if (!(delay > 0)) {
            return 0;
        }
        if (delay >= maxDelayMs) {
            return maxDelayMs;
        }
        return Math.round(delay);
    }
}
