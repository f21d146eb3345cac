package com.foodshare.resilience.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodshare.resilience.backoff.BackoffCalculator;
import com.foodshare.resilience.circuit.CircuitBreakerEvaluator;
import com.foodshare.resilience.circuit.CircuitBreakerStore;
import com.foodshare.resilience.circuit.CircuitSnapshotCodec;
import com.foodshare.resilience.health.ConnectionHealthEvaluator;
import com.foodshare.resilience.health.ConnectionHealthMonitor;
import com.foodshare.resilience.health.HealthThresholds;
import com.foodshare.resilience.observability.FailureClassifier;
import com.foodshare.resilience.observability.ResilienceMetrics;
import com.foodshare.resilience.retry.RetryPolicyEvaluator;
import com.foodshare.resilience.rpc.RateLimitGate;
import com.foodshare.resilience.rpc.RpcFunctionRegistry;
import com.foodshare.resilience.rpc.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Composition root for the resilience engine. Core classes stay framework-free; wiring and
 * property binding happen here.
 */
@Configuration
public class ResilienceConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(ResilienceConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator();
    }

    @Bean
    public RetryPolicyEvaluator retryPolicyEvaluator(FailureClassifier classifier, BackoffCalculator calculator) {
        return new RetryPolicyEvaluator(classifier, calculator);
    }

    @Bean
    public CircuitSnapshotCodec circuitSnapshotCodec(ObjectMapper objectMapper) {
        return new CircuitSnapshotCodec(objectMapper);
    }

    @Bean
    public CircuitBreakerEvaluator circuitBreakerEvaluator(Clock clock, CircuitSnapshotCodec codec) {
        return new CircuitBreakerEvaluator(clock, codec);
    }

    @Bean
    public CircuitBreakerStore circuitBreakerStore(CircuitBreakerEvaluator evaluator, Clock clock,
                                                   ResilienceMetrics metrics) {
        CircuitBreakerStore store = new CircuitBreakerStore(evaluator, clock);
        store.addListener((key, from, to) -> metrics.setCircuitState(key, to));
        return store;
    }

    @Bean
    public HealthThresholds healthThresholds(
            @Value("${resilience.health.max-error-penalty:70}") double maxErrorPenalty,
            @Value("${resilience.health.latency-good-ms:300}") double latencyGoodMs,
            @Value("${resilience.health.latency-slow-ms:1000}") double latencySlowMs,
            @Value("${resilience.health.latency-critical-ms:3000}") double latencyCriticalMs,
            @Value("${resilience.health.moderate-latency-penalty:15}") double moderateLatencyPenalty,
            @Value("${resilience.health.slow-latency-penalty:35}") double slowLatencyPenalty,
            @Value("${resilience.health.critical-latency-penalty:50}") double criticalLatencyPenalty,
            @Value("${resilience.health.excellent-score:90}") int excellentScore,
            @Value("${resilience.health.good-score:70}") int goodScore,
            @Value("${resilience.health.fair-score:40}") int fairScore,
            @Value("${resilience.health.poor-score:15}") int poorScore) {
        return new HealthThresholds(maxErrorPenalty, latencyGoodMs, latencySlowMs, latencyCriticalMs,
                moderateLatencyPenalty, slowLatencyPenalty, criticalLatencyPenalty,
                excellentScore, goodScore, fairScore, poorScore);
    }

    @Bean
    public ConnectionHealthEvaluator connectionHealthEvaluator(HealthThresholds thresholds) {
        return new ConnectionHealthEvaluator(thresholds);
    }

    @Bean
    public ConnectionHealthMonitor connectionHealthMonitor(
            ConnectionHealthEvaluator evaluator,
            ResilienceMetrics metrics,
            @Value("${resilience.health.window-size:50}") int windowSize) {
        ConnectionHealthMonitor monitor = new ConnectionHealthMonitor(evaluator, windowSize);
        metrics.registerHealthGauge(monitor);
        return monitor;
    }

    @Bean
    public RpcFunctionRegistry rpcFunctionRegistry(
            @Value("${resilience.rpc.preset-overrides:}") String presetOverrides) {
        RpcFunctionRegistry registry = RpcFunctionRegistry.withDefaults();
        int applied = registry.applyPresetOverrides(presetOverrides);
        logger.info("RPC registry initialized: functions={}, overrides={}",
                registry.registeredFunctions().size(), applied);
        return registry;
    }

    @Bean
    public RateLimitGate rateLimitGate(
            @Value("${resilience.rpc.global-max-requests:300}") int globalMaxRequests,
            @Value("${resilience.rpc.global-window-ms:60000}") long globalWindowMs) {
        logger.info("Global RPC rate limit: {} requests per {}ms", globalMaxRequests, globalWindowMs);
        return new RateLimitGate(globalMaxRequests, globalWindowMs);
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
