package com.foodshare.resilience;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodshare.resilience.backoff.BackoffCalculator;
import com.foodshare.resilience.circuit.CircuitBreakerEvaluator;
import com.foodshare.resilience.circuit.CircuitBreakerStore;
import com.foodshare.resilience.circuit.CircuitSnapshotCodec;
import com.foodshare.resilience.circuit.CircuitState;
import com.foodshare.resilience.health.ConnectionHealthEvaluator;
import com.foodshare.resilience.health.ConnectionHealthMonitor;
import com.foodshare.resilience.health.ConnectionStatus;
import com.foodshare.resilience.observability.FailureClassifier;
import com.foodshare.resilience.observability.ResilienceMetrics;
import com.foodshare.resilience.retry.RetryDecision;
import com.foodshare.resilience.retry.RetryPolicyEvaluator;
import com.foodshare.resilience.rpc.RateLimitGate;
import com.foodshare.resilience.rpc.ResilientRpcExecutor;
import com.foodshare.resilience.rpc.RpcFunctionRegistry;
import com.foodshare.resilience.rpc.RpcPreset;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResilienceControllerTest {

    private CircuitBreakerStore circuitStore;
    private ConnectionHealthMonitor healthMonitor;
    private ResilienceController controller;

    @BeforeEach
    void setup() {
        MutableClock clock = new MutableClock(0);
        FailureClassifier classifier = new FailureClassifier();
        BackoffCalculator calculator = new BackoffCalculator(() -> 0.5);
        RetryPolicyEvaluator retryPolicy = new RetryPolicyEvaluator(classifier, calculator);
        RpcFunctionRegistry registry = RpcFunctionRegistry.withDefaults();
        circuitStore = new CircuitBreakerStore(
                new CircuitBreakerEvaluator(clock, new CircuitSnapshotCodec(new ObjectMapper())), clock);
        healthMonitor = new ConnectionHealthMonitor(new ConnectionHealthEvaluator(), 10);
        ResilientRpcExecutor executor = new ResilientRpcExecutor(registry, new RateLimitGate(300, 60_000),
                circuitStore, retryPolicy, classifier, healthMonitor,
                new ResilienceMetrics(new SimpleMeterRegistry(), classifier), event -> { }, millis -> { });
        controller = new ResilienceController(registry, executor, healthMonitor, calculator, retryPolicy);
    }

    @Test
    void testConfig() {
        ResilienceController.FunctionConfigResponse response = controller.config("sign_in");
        assertTrue(response.registered());
        assertTrue(response.requiresAuditLog());
        assertEquals(RpcPreset.STRICT.config(), response.config());

        assertFalse(controller.config("unregistered_fn").registered());
    }

    @Test
    void testCircuitsAndReset() {
        circuitStore.forceOpen("sync_delta", RpcPreset.SYNC.config().circuitBreakerConfig());
        assertEquals(CircuitState.OPEN, controller.circuits().get("sync_delta").state());

        controller.resetCircuit("sync_delta");
        assertTrue(controller.circuits().isEmpty());
    }

    @Test
    void testHealth() {
        healthMonitor.setConnectionType("wifi");
        assertEquals(ConnectionStatus.HEALTHY, controller.health(null).status());
        assertEquals(ConnectionStatus.DISCONNECTED, controller.health("none").status());
    }

    @Test
    void testBackoff() {
        ResilienceController.BackoffResponse response = controller.backoff(2, 100, 30_000, "exponential");
        assertEquals(400, response.delayMs());
        assertEquals("exponential", response.strategy());

        assertThrows(IllegalArgumentException.class, () -> controller.backoff(0, 500, 100, null));
    }

    @Test
    void testRetry() {
        RetryDecision decision = controller.retry(429, 0, 3);
        assertTrue(decision.shouldRetry());
        assertFalse(controller.retry(400, 0, 3).shouldRetry());
    }

    @Test
    void testBadRequestHandler() {
        assertEquals("bad", controller.badRequest(new IllegalArgumentException("bad")).get("error"));
    }
}
