package com.foodshare.resilience.rpc;

import com.foodshare.resilience.observability.ErrorReason;
import org.springframework.lang.Nullable;

/**
 * Final failure of an RPC call after the retry policy gave up.
 */
public class RpcInvocationException extends RpcException {

    private final ErrorReason reason;
    private final int statusCode;
    private final int attempts;

    public RpcInvocationException(String functionName, ErrorReason reason, int statusCode, int attempts,
                                  String decisionReason, @Nullable Throwable cause) {
        super(functionName, functionName + " failed after " + attempts + " attempt(s): " + decisionReason, cause);
        this.reason = reason;
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public ErrorReason getReason() {
        return reason;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public int getAttempts() {
        return attempts;
    }
}
