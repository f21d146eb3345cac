package com.foodshare.resilience.health;

import org.springframework.lang.Nullable;

/**
 * Scores a connection from its recent error rate, average latency and transport type.
 *
 * score = 100 - errorRate * maxErrorPenalty - latencyPenalty, clamped to [0, 100].
 * Quality tiers and status follow the score; a missing connection is always disconnected.
 */
public class ConnectionHealthEvaluator {

    private final HealthThresholds thresholds;

    public ConnectionHealthEvaluator() {
        this(HealthThresholds.DEFAULTS);
    }

    public ConnectionHealthEvaluator(HealthThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public ConnectionHealthResult evaluateConnectionHealth(double errorRate, @Nullable Double averageLatencyMs,
                                                           @Nullable String connectionType) {
        return evaluateConnectionHealth(errorRate, averageLatencyMs, ConnectionType.fromValue(connectionType));
    }

    /**
     * @param connectionType transport in use; null means no connection
     */
    public ConnectionHealthResult evaluateConnectionHealth(double errorRate, @Nullable Double averageLatencyMs,
                                                           @Nullable ConnectionType connectionType) {
        ConnectionType type = connectionType == null ? ConnectionType.NONE : connectionType;
        double rate = Double.isNaN(errorRate) ? 0 : Math.max(0, Math.min(1, errorRate));

        int score;
        ConnectionStatus status;
        if (type == ConnectionType.NONE) {
            score = 0;
            status = ConnectionStatus.DISCONNECTED;
        } else {
            double raw = 100 - rate * thresholds.maxErrorPenalty() - latencyPenalty(averageLatencyMs);
            score = (int) Math.max(0, Math.min(100, Math.round(raw)));
            status = statusFor(score);
        }

        return new ConnectionHealthResult(
                status,
                qualityFor(score),
                score,
                averageLatencyMs,
                rate,
                type,
                status.recommendation(),
                status != ConnectionStatus.DISCONNECTED,
                status == ConnectionStatus.UNSTABLE || status == ConnectionStatus.DISCONNECTED);
    }

    double latencyPenalty(@Nullable Double latencyMs) {
        if (latencyMs == null || latencyMs.isNaN() || latencyMs <= thresholds.latencyGoodMs()) {
            return 0;
        }
        if (latencyMs >= thresholds.latencyCriticalMs()) {
            return thresholds.criticalLatencyPenalty();
        }
        if (latencyMs <= thresholds.latencySlowMs()) {
            return interpolate(latencyMs, thresholds.latencyGoodMs(), thresholds.latencySlowMs(),
                    0, thresholds.moderateLatencyPenalty());
        }
        return interpolate(latencyMs, thresholds.latencySlowMs(), thresholds.latencyCriticalMs(),
                thresholds.moderateLatencyPenalty(), thresholds.slowLatencyPenalty());
    }

    private static double interpolate(double x, double x0, double x1, double y0, double y1) {
        return y0 + (x - x0) / (x1 - x0) * (y1 - y0);
    }

    private ConnectionStatus statusFor(int score) {
        if (score >= thresholds.goodScore()) {
            return ConnectionStatus.HEALTHY;
        }
        if (score >= thresholds.fairScore()) {
            return ConnectionStatus.DEGRADED;
        }
        if (score >= thresholds.poorScore()) {
            return ConnectionStatus.UNSTABLE;
        }
        return ConnectionStatus.DISCONNECTED;
    }

    private ConnectionQuality qualityFor(int score) {
        if (score >= thresholds.excellentScore()) {
            return ConnectionQuality.EXCELLENT;
        }
        if (score >= thresholds.goodScore()) {
            return ConnectionQuality.GOOD;
        }
        if (score >= thresholds.fairScore()) {
            return ConnectionQuality.FAIR;
        }
        if (score >= thresholds.poorScore()) {
            return ConnectionQuality.POOR;
        }
        return ConnectionQuality.NONE;
    }
}
