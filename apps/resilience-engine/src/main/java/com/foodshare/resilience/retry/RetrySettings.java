package com.foodshare.resilience.retry;

import com.foodshare.resilience.backoff.BackoffStrategy;
import com.foodshare.resilience.rpc.RpcConfig;

/**
 * Retry envelope handed to {@link RetryPolicyEvaluator}.
 *
 * @param maxAttempts    total attempts including the first one
 * @param retryOnUnknown whether statuses outside every known class (1xx, 3xx, >= 600) and
 *                       unclassified exceptions are retried
 */
public record RetrySettings(
    int maxAttempts,
    BackoffStrategy strategy,
    long baseDelayMs,
    long maxDelayMs,
    boolean retryOnUnknown
) {
    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                    "Invalid retry delays: baseDelayMs=" + baseDelayMs + ", maxDelayMs=" + maxDelayMs);
        }
    }

    /**
     * Settings for an RPC function: one initial attempt plus {@code maxRetries} retries.
     */
    public static RetrySettings from(RpcConfig config) {
        return new RetrySettings(
                config.maxRetries() + 1,
                BackoffStrategy.EXPONENTIAL_WITH_JITTER,
                config.initialRetryDelayMs(),
                config.maxRetryDelayMs(),
                false);
    }

    public RetrySettings withMaxAttempts(int attempts) {
        return new RetrySettings(attempts, strategy, baseDelayMs, maxDelayMs, retryOnUnknown);
    }
}
