package com.foodshare.resilience.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes audit events to the dedicated "audit" logger, one line per audited invocation.
 */
@Component
public class Slf4jAuditLogger implements AuditLogger {
    private static final Logger audit = LoggerFactory.getLogger("audit");

    @Override
    public void record(AuditEvent event) {
        audit.info("AUDIT [{}] function={} result={} status={} attempts={} durationMs={}",
                event.requestId(), event.functionName(), event.success() ? "SUCCESS" : "FAILURE",
                event.statusCode(), event.attempts(), event.durationMs());
    }
}
