package com.foodshare.resilience.health;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionHealthEvaluatorTest {

    private final ConnectionHealthEvaluator evaluator = new ConnectionHealthEvaluator();

    @Test
    void testPerfectConnection() {
        ConnectionHealthResult result = evaluator.evaluateConnectionHealth(0.0, 120.0, "wifi");
        assertEquals(100, result.healthScore());
        assertEquals(ConnectionStatus.HEALTHY, result.status());
        assertEquals(ConnectionQuality.EXCELLENT, result.quality());
        assertEquals(ConnectionType.WIFI, result.connectionType());
        assertTrue(result.shouldProceed());
        assertFalse(result.shouldUseOfflineMode());
        assertFalse(result.shouldDeferBackgroundTraffic());
        assertEquals("Connection is healthy", result.recommendation());
    }

    @Test
    void testNoConnection_AlwaysDisconnected() {
        ConnectionHealthResult result = evaluator.evaluateConnectionHealth(0.0, 50.0, "none");
        assertEquals(0, result.healthScore());
        assertEquals(ConnectionStatus.DISCONNECTED, result.status());
        assertEquals(ConnectionQuality.NONE, result.quality());
        assertFalse(result.shouldProceed());
        assertTrue(result.shouldUseOfflineMode());
        assertEquals("Switch to offline mode", result.recommendation());
    }

    @Test
    void testMissingType_TreatedAsNoConnection() {
        assertEquals(ConnectionStatus.DISCONNECTED,
                evaluator.evaluateConnectionHealth(0.0, null, (String) null).status());
    }

    @Test
    void testNullEnumType_TreatedAsNoConnection() {
        ConnectionHealthResult result = evaluator.evaluateConnectionHealth(0.0, 50.0, (ConnectionType) null);
        assertEquals(ConnectionStatus.DISCONNECTED, result.status());
        assertEquals(0, result.healthScore());
        assertEquals(ConnectionType.NONE, result.connectionType());
        assertFalse(result.shouldProceed());
    }

    @Test
    void testUnrecognizedType_EvaluatedNormally() {
        ConnectionHealthResult result = evaluator.evaluateConnectionHealth(0.0, null, "satellite");
        assertEquals(ConnectionType.UNKNOWN, result.connectionType());
        assertEquals(100, result.healthScore());
    }

    @Test
    void testErrorRatePenalty() {
        ConnectionHealthResult result = evaluator.evaluateConnectionHealth(0.5, null, ConnectionType.CELLULAR);
        assertEquals(65, result.healthScore());
        assertEquals(ConnectionStatus.DEGRADED, result.status());
        assertEquals(ConnectionQuality.FAIR, result.quality());
        assertTrue(result.shouldProceed());
        assertTrue(result.shouldDeferBackgroundTraffic());
    }

    @Test
    void testLatencyPenaltyCurve() {
        assertEquals(0.0, evaluator.latencyPenalty(null));
        assertEquals(0.0, evaluator.latencyPenalty(300.0));
        assertEquals(7.5, evaluator.latencyPenalty(650.0), 1e-9);
        assertEquals(15.0, evaluator.latencyPenalty(1000.0), 1e-9);
        assertEquals(25.0, evaluator.latencyPenalty(2000.0), 1e-9);
        assertEquals(50.0, evaluator.latencyPenalty(3000.0));
        assertEquals(50.0, evaluator.latencyPenalty(30_000.0));
    }

    @Test
    void testPenaltyNeverDecreasesWithLatency() {
        double previous = 0;
        for (double latency = 0; latency <= 5000; latency += 50) {
            double penalty = evaluator.latencyPenalty(latency);
            assertTrue(penalty >= previous, "penalty dropped at " + latency + "ms");
            previous = penalty;
        }
    }

    @Test
    void testSlowConnection() {
        ConnectionHealthResult result = evaluator.evaluateConnectionHealth(0.0, 2000.0, ConnectionType.ETHERNET);
        assertEquals(75, result.healthScore());
        assertEquals(ConnectionStatus.HEALTHY, result.status());
        assertEquals(ConnectionQuality.GOOD, result.quality());
    }

    @Test
    void testUnstableConnection() {
        ConnectionHealthResult result = evaluator.evaluateConnectionHealth(1.0, 1000.0, ConnectionType.WIFI);
        assertEquals(15, result.healthScore());
        assertEquals(ConnectionStatus.UNSTABLE, result.status());
        assertEquals(ConnectionQuality.POOR, result.quality());
        assertTrue(result.shouldProceed());
        assertTrue(result.shouldUseOfflineMode());
    }

    @Test
    void testScoreClampedAtZero() {
        ConnectionHealthResult result = evaluator.evaluateConnectionHealth(1.0, 3000.0, ConnectionType.WIFI);
        assertEquals(0, result.healthScore());
        assertEquals(ConnectionStatus.DISCONNECTED, result.status());
        assertFalse(result.shouldProceed());
    }

    @Test
    void testErrorRateClamped() {
        assertEquals(30, evaluator.evaluateConnectionHealth(2.5, null, ConnectionType.WIFI).healthScore());
        assertEquals(1.0, evaluator.evaluateConnectionHealth(2.5, null, ConnectionType.WIFI).errorRate());
        assertEquals(100, evaluator.evaluateConnectionHealth(-1, null, ConnectionType.WIFI).healthScore());
        assertEquals(100, evaluator.evaluateConnectionHealth(Double.NaN, null, ConnectionType.WIFI).healthScore());
    }

    @Test
    void testCustomThresholds() {
        HealthThresholds strict = new HealthThresholds(100, 100, 500, 1000, 20, 40, 60, 95, 80, 50, 20);
        ConnectionHealthEvaluator custom = new ConnectionHealthEvaluator(strict);
        ConnectionHealthResult result = custom.evaluateConnectionHealth(0.25, null, ConnectionType.WIFI);
        assertEquals(75, result.healthScore());
        assertEquals(ConnectionStatus.DEGRADED, result.status());
    }

    @Test
    void testInvalidThresholds() {
        assertThrows(IllegalArgumentException.class,
                () -> new HealthThresholds(70, 1000, 300, 3000, 15, 35, 50, 90, 70, 40, 15));
        assertThrows(IllegalArgumentException.class,
                () -> new HealthThresholds(70, 300, 1000, 3000, 15, 35, 50, 60, 70, 40, 15));
    }
}
