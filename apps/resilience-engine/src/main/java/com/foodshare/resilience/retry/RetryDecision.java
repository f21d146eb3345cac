package com.foodshare.resilience.retry;

/**
 * Outcome of evaluating one failed attempt.
 *
 * @param delayMs wait before the next attempt, 0 when not retrying
 * @param reason  human-readable reason for logs and telemetry
 */
public record RetryDecision(boolean shouldRetry, long delayMs, String reason) {

    public static RetryDecision retry(long delayMs, String reason) {
        return new RetryDecision(true, delayMs, reason);
    }

    public static RetryDecision giveUp(String reason) {
        return new RetryDecision(false, 0, reason);
    }
}
