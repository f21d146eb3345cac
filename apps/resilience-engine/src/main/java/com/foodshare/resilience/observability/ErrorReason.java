package com.foodshare.resilience.observability;

/**
 * Fixed error taxonomy for RPC client outcomes.
 * Used as the 'reason' label in rpc_client_requests_total metric.
 */
public enum ErrorReason {
    SUCCESS,                 // 2xx
    NETWORK_FAILURE,         // No response: connection refused, DNS failure, reset
    TIMEOUT,                 // 408 or socket timeout
    RATE_LIMITED,            // 429 from the backend
    SERVER_UNAVAILABLE,      // 500, 502, 503, 504
    SERVER_ERROR,            // Other 5xx (501, 505, ...)
    CLIENT_ERROR,            // 4xx other than 408/429
    CIRCUIT_OPEN,            // Circuit breaker rejected
    RATE_LIMIT_REJECTED,     // Client-side rate limiter rejected
    UNKNOWN                  // Fallback
}
