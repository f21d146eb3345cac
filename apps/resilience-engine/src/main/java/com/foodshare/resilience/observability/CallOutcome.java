package com.foodshare.resilience.observability;

/**
 * Classification result for an RPC call outcome.
 *
 * @param statusCode HTTP status when one was received, {@link FailureClassifier#NO_STATUS} otherwise
 */
public record CallOutcome(
    ErrorReason reason,
    boolean retryable,
    int statusCode
) {
    public boolean isSuccess() {
        return reason == ErrorReason.SUCCESS;
    }

    public boolean isProtectionEvent() {
        return reason == ErrorReason.CIRCUIT_OPEN || reason == ErrorReason.RATE_LIMIT_REJECTED;
    }

    public String resultLabel() {
        return isSuccess() ? "SUCCESS" : "FAILURE";
    }

    public String statusLabel() {
        return statusCode > 0 ? String.valueOf(statusCode) : reason.name();
    }
}
