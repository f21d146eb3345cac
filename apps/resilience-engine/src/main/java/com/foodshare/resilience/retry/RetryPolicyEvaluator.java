package com.foodshare.resilience.retry;

import com.foodshare.resilience.backoff.BackoffCalculator;
import com.foodshare.resilience.observability.CallOutcome;
import com.foodshare.resilience.observability.ErrorReason;
import com.foodshare.resilience.observability.FailureClassifier;
import com.foodshare.resilience.rpc.RpcStatusException;
import org.springframework.lang.Nullable;

/**
 * Retry Decision Policy: classifier-based retry gating plus backoff.
 *
 * Decision flow for a failed attempt:
 * 1. Attempts exhausted? → NO retry, regardless of the failure
 * 2. Success status? → NO retry (callers should not ask, but the answer must be safe)
 * 3. Protection event (CIRCUIT_OPEN, RATE_LIMIT_REJECTED)? → NO retry
 * 4. Retryable per classifier (408, 429, 500/502/503/504, no response)? → retry after backoff,
 *    or after the server-supplied Retry-After delay for 429/503, capped at maxDelayMs
 * 5. UNKNOWN? → retry only when the settings opt in
 * 6. Anything else (4xx, other 5xx) → NO retry
 *
 * Referentially transparent apart from jitter; safe to call from any thread.
 */
public class RetryPolicyEvaluator {

    public static final String MAX_ATTEMPTS_EXCEEDED = "max attempts exceeded";

    private final FailureClassifier classifier;
    private final BackoffCalculator backoffCalculator;
    private final RetrySettings defaults;

    public RetryPolicyEvaluator(FailureClassifier classifier, BackoffCalculator backoffCalculator) {
        this(classifier, backoffCalculator, RetryPreset.DEFAULT.settings());
    }

    public RetryPolicyEvaluator(FailureClassifier classifier, BackoffCalculator backoffCalculator,
                                RetrySettings defaults) {
        this.classifier = classifier;
        this.backoffCalculator = backoffCalculator;
        this.defaults = defaults;
    }

    /**
     * Decide whether a request that failed with {@code statusCode} should be retried.
     *
     * @param statusCode     HTTP status, or a value <= 0 when no response was received
     * @param currentAttempt attempt that just failed (0-indexed)
     * @param maxAttempts    total attempts allowed
     */
    public RetryDecision shouldRetry(int statusCode, int currentAttempt, int maxAttempts) {
        return shouldRetry(statusCode, currentAttempt, maxAttempts, defaults);
    }

    public RetryDecision shouldRetry(int statusCode, int currentAttempt, int maxAttempts, RetrySettings settings) {
        if (isExhausted(currentAttempt, maxAttempts)) {
            return RetryDecision.giveUp(MAX_ATTEMPTS_EXCEEDED);
        }
        return decide(classifier.classify(statusCode), null, currentAttempt, settings);
    }

    /**
     * Decide for a response that carried a {@code Retry-After} delay, using {@code settings.maxAttempts()}.
     *
     * @param retryAfterMs server-requested delay, or null when the response had none
     */
    public RetryDecision shouldRetry(int statusCode, @Nullable Long retryAfterMs, int currentAttempt,
                                     RetrySettings settings) {
        if (isExhausted(currentAttempt, settings.maxAttempts())) {
            return RetryDecision.giveUp(MAX_ATTEMPTS_EXCEEDED);
        }
        return decide(classifier.classify(statusCode), retryAfterMs, currentAttempt, settings);
    }

    /**
     * Decide for a failure thrown by the transport, using {@code settings.maxAttempts()}.
     */
    public RetryDecision shouldRetry(@Nullable Throwable failure, int currentAttempt, RetrySettings settings) {
        if (isExhausted(currentAttempt, settings.maxAttempts())) {
            return RetryDecision.giveUp(MAX_ATTEMPTS_EXCEEDED);
        }
        Long retryAfterMs = failure instanceof RpcStatusException status ? status.getRetryAfterMs() : null;
        return decide(classifier.classify(failure), retryAfterMs, currentAttempt, settings);
    }

    private static boolean isExhausted(int currentAttempt, int maxAttempts) {
        return Math.max(0, currentAttempt) + 1 >= maxAttempts;
    }

    private RetryDecision decide(CallOutcome outcome, @Nullable Long retryAfterMs, int currentAttempt,
                                 RetrySettings settings) {
        if (outcome.isSuccess()) {
            return RetryDecision.giveUp("success response is not retried");
        }

        // Protection events MUST NOT be retried, even though the classifier
        // already marks them retryable=false.
        if (outcome.isProtectionEvent()) {
            return RetryDecision.giveUp("protection event " + outcome.reason() + " is not retried");
        }

        boolean retryable = outcome.retryable()
                || (outcome.reason() == ErrorReason.UNKNOWN && settings.retryOnUnknown());
        if (!retryable) {
            return RetryDecision.giveUp("not retryable: " + outcome.reason() + " (" + outcome.statusLabel() + ")");
        }

        if (retryAfterMs != null && honorsRetryAfter(outcome.statusCode())) {
            long delayMs = Math.min(Math.max(0, retryAfterMs), settings.maxDelayMs());
            return RetryDecision.retry(delayMs,
                    "retryable: " + outcome.reason() + " (" + outcome.statusLabel() + "), server requested "
                            + retryAfterMs + "ms, attempt " + (Math.max(0, currentAttempt) + 1));
        }

        long delayMs = backoffCalculator.calculateBackoff(
                currentAttempt, settings.baseDelayMs(), settings.maxDelayMs(), settings.strategy());
        return RetryDecision.retry(delayMs,
                "retryable: " + outcome.reason() + " (" + outcome.statusLabel() + "), attempt "
                        + (Math.max(0, currentAttempt) + 1));
    }

    private static boolean honorsRetryAfter(int statusCode) {
        return statusCode == 429 || statusCode == 503;
    }
}
