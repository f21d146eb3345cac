package com.foodshare.resilience.health;

/**
 * Breakpoints for connection health scoring.
 *
 * Latency penalty: none below {@code latencyGoodMs}; rises linearly to {@code moderateLatencyPenalty}
 * at {@code latencySlowMs}, then to {@code slowLatencyPenalty} just below {@code latencyCriticalMs};
 * {@code criticalLatencyPenalty} from {@code latencyCriticalMs} on.
 */
public record HealthThresholds(
    double maxErrorPenalty,
    double latencyGoodMs,
    double latencySlowMs,
    double latencyCriticalMs,
    double moderateLatencyPenalty,
    double slowLatencyPenalty,
    double criticalLatencyPenalty,
    int excellentScore,
    int goodScore,
    int fairScore,
    int poorScore
) {
    public static final HealthThresholds DEFAULTS =
            new HealthThresholds(70, 300, 1000, 3000, 15, 35, 50, 90, 70, 40, 15);

    public HealthThresholds {
        if (!(latencyGoodMs < latencySlowMs && latencySlowMs < latencyCriticalMs)) {
            throw new IllegalArgumentException("Latency breakpoints must increase: "
                    + latencyGoodMs + ", " + latencySlowMs + ", " + latencyCriticalMs);
        }
        if (!(excellentScore > goodScore && goodScore > fairScore && fairScore > poorScore && poorScore >= 0)) {
            throw new IllegalArgumentException("Score tiers must decrease: "
                    + excellentScore + ", " + goodScore + ", " + fairScore + ", " + poorScore);
        }
    }
}
