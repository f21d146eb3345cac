package com.foodshare.resilience.observability;

import com.foodshare.resilience.circuit.CircuitState;
import com.foodshare.resilience.health.ConnectionHealthMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for RPC calls made through the resilience engine.
 * Exposed via the /actuator/prometheus endpoint.
 */
@Service
public class ResilienceMetrics {
    private final MeterRegistry registry;
    private final FailureClassifier classifier;
    private final Map<String, AtomicInteger> circuitStates = new ConcurrentHashMap<>();

    public ResilienceMetrics(MeterRegistry registry, FailureClassifier classifier) {
        this.registry = registry;
        this.classifier = classifier;
    }

    /**
     * Record one attempt of an RPC function.
     *
     * @param functionName logical RPC function name
     * @param latencyMs    attempt latency in milliseconds
     * @param error        failure thrown by the call, or null for success
     */
    public void recordCall(String functionName, long latencyMs, @Nullable Throwable error) {
        CallOutcome outcome = classifier.classify(error);

        Counter.builder("rpc_client_requests_total")
            .description("Total RPC client requests")
            .tag("function", functionName)
            .tag("result", outcome.resultLabel())
            .tag("reason", outcome.reason().name())
            .tag("retryable", String.valueOf(outcome.retryable()))
            .register(registry)
            .increment();

        // Histogram buckets for PromQL histogram_quantile() queries
        Timer.builder("rpc_client_latency_ms")
            .description("RPC client request latency")
            .tag("function", functionName)
            .serviceLevelObjectives(
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(300),
                Duration.ofMillis(1000),
                Duration.ofMillis(3000),
                Duration.ofMillis(10000)
            )
            .register(registry)
            .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void recordRetry(String functionName) {
        Counter.builder("rpc_client_retries_total")
            .description("Retries scheduled by the retry policy")
            .tag("function", functionName)
            .register(registry)
            .increment();
    }

    public void recordRetryBudgetExhausted(String functionName) {
        Counter.builder("rpc_client_retry_budget_exhausted_total")
            .description("Retries skipped because the shared retry budget was spent")
            .tag("function", functionName)
            .register(registry)
            .increment();
    }

    /**
     * Record a request refused locally by a protection mechanism.
     */
    public void recordRejection(String functionName, ErrorReason reason) {
        Counter.builder("rpc_client_rejections_total")
            .description("Requests rejected before reaching the server")
            .tag("function", functionName)
            .tag("reason", reason.name())
            .register(registry)
            .increment();
    }

    /**
     * Circuit state gauge (0=closed, 1=open, 2=half-open), one series per function.
     */
    public void setCircuitState(String functionName, CircuitState state) {
        circuitStates.computeIfAbsent(functionName, fn -> {
            AtomicInteger holder = new AtomicInteger();
            Gauge.builder("rpc_circuit_state", holder, AtomicInteger::get)
                .description("Circuit breaker state per RPC function")
                .tag("function", fn)
                .register(registry);
            return holder;
        }).set(state.code());
    }

    public void registerHealthGauge(ConnectionHealthMonitor monitor) {
        Gauge.builder("connection_health_score", monitor, ConnectionHealthMonitor::lastHealthScore)
            .description("Last computed connection health score (0-100)")
            .register(registry);
    }
}
