package com.foodshare.resilience.rpc;

import com.foodshare.resilience.circuit.CircuitBreakerConfig;

/**
 * Resilience tuning for one logical RPC function. Immutable.
 *
 * @param maxRequests             requests allowed per window
 * @param windowMs                rate-limit window
 * @param circuitFailureThreshold failures before the circuit opens
 * @param circuitResetTimeoutMs   time an open circuit waits before probing
 * @param maxRetries              retries after the first attempt
 * @param initialRetryDelayMs     backoff base delay
 * @param maxRetryDelayMs         backoff cap
 * @param timeoutMs               per-request timeout, enforced by the transport
 * @param requiresAuditLog        whether invocations go to the compliance audit trail
 */
public record RpcConfig(
    int maxRequests,
    long windowMs,
    int circuitFailureThreshold,
    long circuitResetTimeoutMs,
    int maxRetries,
    long initialRetryDelayMs,
    long maxRetryDelayMs,
    long timeoutMs,
    boolean requiresAuditLog
) {
    public RpcConfig {
        if (maxRequests < 1 || windowMs < 1) {
            throw new IllegalArgumentException(
                    "Invalid rate limit: maxRequests=" + maxRequests + ", windowMs=" + windowMs);
        }
        if (circuitFailureThreshold < 1) {
            throw new IllegalArgumentException("circuitFailureThreshold must be >= 1: " + circuitFailureThreshold);
        }
        if (circuitResetTimeoutMs < 0) {
            throw new IllegalArgumentException("circuitResetTimeoutMs must be >= 0: " + circuitResetTimeoutMs);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (initialRetryDelayMs < 0 || initialRetryDelayMs > maxRetryDelayMs) {
            throw new IllegalArgumentException("Invalid retry delays: initialRetryDelayMs=" + initialRetryDelayMs
                    + ", maxRetryDelayMs=" + maxRetryDelayMs);
        }
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("timeoutMs must be >= 1: " + timeoutMs);
        }
    }

    public RpcConfig withAuditLog(boolean audit) {
        return new RpcConfig(maxRequests, windowMs, circuitFailureThreshold, circuitResetTimeoutMs, maxRetries,
                initialRetryDelayMs, maxRetryDelayMs, timeoutMs, audit);
    }

    /**
     * Circuit tuning for this function: its own threshold and reset timeout, the default
     * preset's success threshold, failure window and half-open share.
     */
    public CircuitBreakerConfig circuitBreakerConfig() {
        return CircuitBreakerConfig.DEFAULT.withThresholds(circuitFailureThreshold, circuitResetTimeoutMs / 1000.0);
    }
}
