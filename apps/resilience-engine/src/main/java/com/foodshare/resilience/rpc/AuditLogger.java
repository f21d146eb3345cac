package com.foodshare.resilience.rpc;

/**
 * Boundary to the compliance audit trail.
 */
public interface AuditLogger {

    /**
     * @param statusCode HTTP status of the last failure, 0 when none was received or the call succeeded
     */
    record AuditEvent(
        String requestId,
        String functionName,
        boolean success,
        int statusCode,
        int attempts,
        long durationMs
    ) {
    }

    void record(AuditEvent event);
}
