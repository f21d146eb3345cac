package com.foodshare.resilience.observability;

import com.foodshare.resilience.rpc.CircuitOpenException;
import com.foodshare.resilience.rpc.RateLimitExceededException;
import com.foodshare.resilience.rpc.RpcStatusException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Error Classifier: maps HTTP statuses and exceptions to a semantic ErrorReason + retryability.
 *
 * HTTP statuses are too granular for telemetry and retry decisions, so they are grouped:
 * - 408, 429, 500, 502, 503, 504 and failures without a response are transient (retryable)
 * - other 4xx are client errors that will not resolve by retrying
 * - other 5xx (501, 505, ...) are server faults, not outages
 * - protection events (circuit open, client rate limit) are never retryable
 *
 * Used by: ResilienceMetrics (reason label), RetryPolicyEvaluator (retry gating)
 */
@Component
public class FailureClassifier {

    /** Status code used when no HTTP response was received. */
    public static final int NO_STATUS = 0;

    public CallOutcome classify(int statusCode) {
        if (statusCode <= NO_STATUS) {
            return new CallOutcome(ErrorReason.NETWORK_FAILURE, true, NO_STATUS);
        }
        if (statusCode >= 200 && statusCode < 300) {
            return new CallOutcome(ErrorReason.SUCCESS, false, statusCode);
        }
        return switch (statusCode) {
            case 408 -> new CallOutcome(ErrorReason.TIMEOUT, true, statusCode);
            case 429 -> new CallOutcome(ErrorReason.RATE_LIMITED, true, statusCode);
            case 500, 502, 503, 504 -> new CallOutcome(ErrorReason.SERVER_UNAVAILABLE, true, statusCode);
            default -> {
                if (statusCode >= 400 && statusCode < 500) {
                    yield new CallOutcome(ErrorReason.CLIENT_ERROR, false, statusCode);
                }
                if (statusCode >= 500 && statusCode < 600) {
                    yield new CallOutcome(ErrorReason.SERVER_ERROR, false, statusCode);
                }
                yield new CallOutcome(ErrorReason.UNKNOWN, false, statusCode);
            }
        };
    }

    /**
     * Classify a failure thrown by an RPC transport. A null throwable is a success.
     */
    public CallOutcome classify(@Nullable Throwable throwable) {
        if (throwable == null) {
            return new CallOutcome(ErrorReason.SUCCESS, false, NO_STATUS);
        }

        // Protection events: retrying would defeat the protection
        if (throwable instanceof CircuitOpenException) {
            return new CallOutcome(ErrorReason.CIRCUIT_OPEN, false, NO_STATUS);
        }
        if (throwable instanceof RateLimitExceededException) {
            return new CallOutcome(ErrorReason.RATE_LIMIT_REJECTED, false, NO_STATUS);
        }

        if (throwable instanceof RpcStatusException statusException) {
            return classify(statusException.getStatusCode());
        }

        if (throwable instanceof UncheckedIOException unchecked) {
            return classify(unchecked.getCause());
        }
        if (throwable instanceof SocketTimeoutException || throwable instanceof HttpTimeoutException) {
            return new CallOutcome(ErrorReason.TIMEOUT, true, NO_STATUS);
        }
        // UnknownHostException, ConnectException, connection resets
        if (throwable instanceof IOException) {
            return new CallOutcome(ErrorReason.NETWORK_FAILURE, true, NO_STATUS);
        }

        return new CallOutcome(ErrorReason.UNKNOWN, false, NO_STATUS);
    }
}
