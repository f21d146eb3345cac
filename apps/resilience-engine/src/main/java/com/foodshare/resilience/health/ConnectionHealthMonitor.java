package com.foodshare.resilience.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling window of recent request samples plus the current transport type.
 *
 * Feeds {@link ConnectionHealthEvaluator} with the window's error rate and average latency.
 * Recording and evaluation may run on any thread.
 */
public class ConnectionHealthMonitor {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHealthMonitor.class);

    private record Sample(long latencyMs, boolean success) {
    }

    private final ConnectionHealthEvaluator evaluator;
    private final int windowSize;
    private final Deque<Sample> samples;

    private volatile ConnectionType connectionType = ConnectionType.UNKNOWN;
    private volatile ConnectionStatus lastStatus;
    private volatile int lastHealthScore = 100;

    public ConnectionHealthMonitor(ConnectionHealthEvaluator evaluator, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1: " + windowSize);
        }
        this.evaluator = evaluator;
        this.windowSize = windowSize;
        this.samples = new ArrayDeque<>(windowSize);
    }

    public void recordSuccess(long latencyMs) {
        record(new Sample(latencyMs, true));
    }

    public void recordFailure(long latencyMs) {
        record(new Sample(latencyMs, false));
    }

    private synchronized void record(Sample sample) {
        if (samples.size() == windowSize) {
            samples.removeFirst();
        }
        samples.addLast(sample);
    }

    public void setConnectionType(@Nullable String type) {
        setConnectionType(ConnectionType.fromValue(type));
    }

    public void setConnectionType(ConnectionType type) {
        if (type != connectionType) {
            logger.info("Connection type {} -> {}", connectionType.value(), type.value());
        }
        connectionType = type;
    }

    public ConnectionType getConnectionType() {
        return connectionType;
    }

    public ConnectionHealthResult currentHealth() {
        return currentHealth(connectionType);
    }

    /**
     * Evaluate the window against an explicit transport type.
     */
    public ConnectionHealthResult currentHealth(ConnectionType type) {
        double errorRate;
        Double averageLatency;
        synchronized (this) {
            int failures = 0;
            long totalLatency = 0;
            for (Sample sample : samples) {
                totalLatency += sample.latencyMs();
                if (!sample.success()) {
                    failures++;
                }
            }
            errorRate = samples.isEmpty() ? 0 : (double) failures / samples.size();
            averageLatency = samples.isEmpty() ? null : (double) totalLatency / samples.size();
        }

        ConnectionHealthResult result = evaluator.evaluateConnectionHealth(errorRate, averageLatency, type);
        if (result.status() != lastStatus) {
            logger.info("Connection health {} (score={}, errorRate={}, avgLatencyMs={})",
                    result.status().value(), result.healthScore(), result.errorRate(), result.averageLatencyMs());
            lastStatus = result.status();
        }
        lastHealthScore = result.healthScore();
        return result;
    }

    public int lastHealthScore() {
        return lastHealthScore;
    }

    public synchronized int sampleCount() {
        return samples.size();
    }

    public synchronized void clear() {
        samples.clear();
    }
}
