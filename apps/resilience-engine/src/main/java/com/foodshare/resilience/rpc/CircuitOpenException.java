package com.foodshare.resilience.rpc;

/**
 * The circuit for a function is open; the request was not sent.
 */
public class CircuitOpenException extends RpcException {

    private final long waitTimeMs;

    public CircuitOpenException(String functionName, long waitTimeMs) {
        super(functionName, "Service '" + functionName + "' is temporarily unavailable. Retry in "
                + waitTimeMs + "ms", null);
        this.waitTimeMs = waitTimeMs;
    }

    public long getWaitTimeMs() {
        return waitTimeMs;
    }
}
