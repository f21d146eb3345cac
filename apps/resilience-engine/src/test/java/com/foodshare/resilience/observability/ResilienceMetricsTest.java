package com.foodshare.resilience.observability;

import com.foodshare.resilience.circuit.CircuitState;
import com.foodshare.resilience.health.ConnectionHealthEvaluator;
import com.foodshare.resilience.health.ConnectionHealthMonitor;
import com.foodshare.resilience.rpc.RpcStatusException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ResilienceMetricsTest {

    private SimpleMeterRegistry registry;
    private ResilienceMetrics metrics;

    @BeforeEach
    void setup() {
        registry = new SimpleMeterRegistry();
        metrics = new ResilienceMetrics(registry, new FailureClassifier());
    }

    @Test
    void testRecordCall_TagsOutcome() {
        metrics.recordCall("search_posts", 120, null);
        metrics.recordCall("search_posts", 900, new RpcStatusException(503, "unavailable"));
        metrics.recordCall("search_posts", 5000, new SocketTimeoutException());

        assertEquals(1.0, registry.get("rpc_client_requests_total")
                .tags("function", "search_posts", "result", "SUCCESS", "reason", "SUCCESS", "retryable", "false")
                .counter().count());
        assertEquals(1.0, registry.get("rpc_client_requests_total")
                .tags("result", "FAILURE", "reason", "SERVER_UNAVAILABLE", "retryable", "true")
                .counter().count());
        assertEquals(1.0, registry.get("rpc_client_requests_total")
                .tags("reason", "TIMEOUT").counter().count());

        assertEquals(3, registry.get("rpc_client_latency_ms").tag("function", "search_posts").timer().count());
    }

    @Test
    void testRetriesAndRejections() {
        metrics.recordRetry("sync_delta");
        metrics.recordRetry("sync_delta");
        metrics.recordRejection("sync_delta", ErrorReason.CIRCUIT_OPEN);

        assertEquals(2.0, registry.get("rpc_client_retries_total").tag("function", "sync_delta").counter().count());
        assertEquals(1.0, registry.get("rpc_client_rejections_total")
                .tags("function", "sync_delta", "reason", "CIRCUIT_OPEN").counter().count());
    }

    @Test
    void testCircuitStateGauge() {
        metrics.setCircuitState("sign_in", CircuitState.OPEN);
        assertEquals(1.0, registry.get("rpc_circuit_state").tag("function", "sign_in").gauge().value());

        metrics.setCircuitState("sign_in", CircuitState.HALF_OPEN);
        assertEquals(2.0, registry.get("rpc_circuit_state").tag("function", "sign_in").gauge().value());
        assertEquals(1, registry.find("rpc_circuit_state").gauges().size());
    }

    @Test
    void testHealthGauge() {
        ConnectionHealthMonitor monitor = new ConnectionHealthMonitor(new ConnectionHealthEvaluator(), 10);
        monitor.setConnectionType("cellular");
        metrics.registerHealthGauge(monitor);
        assertEquals(100.0, registry.get("connection_health_score").gauge().value());

        monitor.recordFailure(100);
        monitor.currentHealth();
        assertEquals(30.0, registry.get("connection_health_score").gauge().value());
    }
}
