package com.foodshare.resilience.rpc;

import org.springframework.lang.Nullable;

/**
 * Base type for failures surfaced by {@link ResilientRpcExecutor}.
 */
public abstract class RpcException extends RuntimeException {

    @Nullable
    private final String functionName;

    protected RpcException(@Nullable String functionName, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.functionName = functionName;
    }

    /**
     * Logical RPC function the failure belongs to, or null when raised by a transport
     * that does not know it.
     */
    @Nullable
    public String getFunctionName() {
        return functionName;
    }
}
