package com.foodshare.resilience.rpc;

/**
 * The client-side request envelope for a function (or the global one) is exhausted.
 */
public class RateLimitExceededException extends RpcException {

    private final long waitTimeMs;

    public RateLimitExceededException(String functionName, long waitTimeMs) {
        super(functionName, "Rate limit exceeded for '" + functionName + "'. Retry in " + waitTimeMs + "ms", null);
        this.waitTimeMs = waitTimeMs;
    }

    public long getWaitTimeMs() {
        return waitTimeMs;
    }
}
