package com.foodshare.resilience.rpc;

import org.springframework.lang.Nullable;

/**
 * Thrown by an {@link RpcCall} to report the HTTP status of a failed response.
 */
public class RpcStatusException extends RpcException {

    private final int statusCode;
    @Nullable
    private final Long retryAfterMs;

    public RpcStatusException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    /**
     * @param retryAfterMs delay the server asked for before the next attempt, or null
     */
    public RpcStatusException(int statusCode, String message, @Nullable Long retryAfterMs) {
        super(null, message, null);
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Nullable
    public Long getRetryAfterMs() {
        return retryAfterMs;
    }

    /**
     * Parse a {@code Retry-After} header given in whole seconds. HTTP dates are not supported
     * and yield null, as do blank, negative or malformed values.
     */
    @Nullable
    public static Long parseRetryAfter(@Nullable String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : seconds * 1000;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
