package com.foodshare.resilience.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.springframework.lang.Nullable;

/**
 * Snapshot of connection health, recomputed on demand.
 */
public record ConnectionHealthResult(
    ConnectionStatus status,
    ConnectionQuality quality,
    int healthScore,
    @Nullable Double averageLatencyMs,
    double errorRate,
    ConnectionType connectionType,
    String recommendation,
    boolean shouldProceed,
    boolean shouldUseOfflineMode
) {
    /**
     * Bulk and background traffic should wait unless the connection is healthy.
     */
    @JsonIgnore
    public boolean shouldDeferBackgroundTraffic() {
        return status != ConnectionStatus.HEALTHY;
    }
}
