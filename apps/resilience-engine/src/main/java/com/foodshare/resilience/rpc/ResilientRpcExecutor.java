/**
 * Runs a caller-supplied RPC through the full protection stack.
 *
 * Layers are checked cheapest first, so a shed request never reaches the network:
 * 1. Rate limits (per function, then global) - in-memory permit check
 * 2. Circuit breaker - snapshot evaluation, repeated before every attempt
 * 3. The call itself, then circuit, health and metric recording
 * 4. Retry policy - classifier gating plus backoff between attempts, optionally drawing
 *    from a shared {@link RetryBudget}
 */
package com.foodshare.resilience.rpc;

import com.foodshare.resilience.circuit.CircuitBreakerConfig;
import com.foodshare.resilience.circuit.CircuitBreakerDecision;
import com.foodshare.resilience.circuit.CircuitBreakerStore;
import com.foodshare.resilience.circuit.CircuitSnapshot;
import com.foodshare.resilience.health.ConnectionHealthMonitor;
import com.foodshare.resilience.observability.CallOutcome;
import com.foodshare.resilience.observability.ErrorReason;
import com.foodshare.resilience.observability.FailureClassifier;
import com.foodshare.resilience.observability.ResilienceMetrics;
import com.foodshare.resilience.retry.RetryBudget;
import com.foodshare.resilience.retry.RetryDecision;
import com.foodshare.resilience.retry.RetryPolicyEvaluator;
import com.foodshare.resilience.retry.RetrySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Service
public class ResilientRpcExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ResilientRpcExecutor.class);

    public static final String RETRY_BUDGET_EXHAUSTED = "retry budget exhausted";

    /**
     * One entry of a {@link #batch} request.
     */
    public record BatchCall<T>(String functionName, RpcCall<T> call) {
    }

    private final RpcFunctionRegistry registry;
    private final RateLimitGate rateLimitGate;
    private final CircuitBreakerStore circuitStore;
    private final RetryPolicyEvaluator retryPolicy;
    private final FailureClassifier classifier;
    private final ConnectionHealthMonitor healthMonitor;
    private final ResilienceMetrics metrics;
    private final AuditLogger auditLogger;
    private final Sleeper sleeper;

    public ResilientRpcExecutor(RpcFunctionRegistry registry,
                                RateLimitGate rateLimitGate,
                                CircuitBreakerStore circuitStore,
                                RetryPolicyEvaluator retryPolicy,
                                FailureClassifier classifier,
                                ConnectionHealthMonitor healthMonitor,
                                ResilienceMetrics metrics,
                                AuditLogger auditLogger,
                                Sleeper sleeper) {
        this.registry = registry;
        this.rateLimitGate = rateLimitGate;
        this.circuitStore = circuitStore;
        this.retryPolicy = retryPolicy;
        this.classifier = classifier;
        this.healthMonitor = healthMonitor;
        this.metrics = metrics;
        this.auditLogger = auditLogger;
        this.sleeper = sleeper;
    }

    public <T> RpcResult<T> execute(String functionName, RpcCall<T> call) {
        return execute(functionName, call, null);
    }

    /**
     * @param configOverride config to use instead of the registered one, or null
     */
    public <T> RpcResult<T> execute(String functionName, RpcCall<T> call, @Nullable RpcConfig configOverride) {
        return execute(functionName, call, configOverride, null);
    }

    /**
     * @param configOverride config to use instead of the registered one, or null
     * @param retryBudget    budget every retry of this call must draw from, or null for no cap
     */
    public <T> RpcResult<T> execute(String functionName, RpcCall<T> call, @Nullable RpcConfig configOverride,
                                    @Nullable RetryBudget retryBudget) {
        RpcConfig config = configOverride != null ? configOverride : registry.getConfig(functionName);
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        long start = System.currentTimeMillis();

        RpcResult<T> result = run(requestId, functionName, call, config, retryBudget, start);

        if (config.requiresAuditLog()) {
            audit(result, functionName);
        }
        return result;
    }

    private <T> RpcResult<T> run(String requestId, String functionName, RpcCall<T> call,
                                 RpcConfig config, @Nullable RetryBudget retryBudget, long start) {
        try {
            rateLimitGate.acquire(functionName, config);
        } catch (RateLimitExceededException e) {
            logger.warn("[{}] {} rate limited, retry in {}ms", requestId, functionName, e.getWaitTimeMs());
            metrics.recordRejection(functionName, ErrorReason.RATE_LIMIT_REJECTED);
            return RpcResult.failure(e, requestId, elapsedSince(start), 0);
        }

        CircuitBreakerConfig circuitConfig = config.circuitBreakerConfig();
        RetrySettings retrySettings = RetrySettings.from(config);

        int attempt = 0;
        while (true) {
            CircuitBreakerDecision permit = circuitStore.tryAcquire(functionName, circuitConfig);
            if (!permit.allowed()) {
                long waitMs = permit.waitTimeMs() != null ? permit.waitTimeMs() : circuitConfig.resetTimeoutMs();
                logger.warn("[{}] {} rejected: circuit {} ({}), wait {}ms",
                        requestId, functionName, permit.state().value(), permit.reason(), waitMs);
                metrics.recordRejection(functionName, ErrorReason.CIRCUIT_OPEN);
                return RpcResult.failure(new CircuitOpenException(functionName, waitMs),
                        requestId, elapsedSince(start), attempt);
            }

            long attemptStart = System.currentTimeMillis();
            try {
                logger.debug("[{}] Calling {} (attempt {})", requestId, functionName, attempt + 1);
                T data = call.invoke();
                long latencyMs = elapsedSince(attemptStart);

                circuitStore.recordResult(functionName, circuitConfig, true);
                healthMonitor.recordSuccess(latencyMs);
                metrics.recordCall(functionName, latencyMs, null);
                return RpcResult.success(data, requestId, elapsedSince(start), attempt);
            } catch (InterruptedException e) {
                // The caller gave up on this call; neither the circuit nor health should count it
                Thread.currentThread().interrupt();
                logger.warn("[{}] {} interrupted during attempt {}", requestId, functionName, attempt + 1);
                return RpcResult.failure(
                        new RpcInvocationException(functionName, ErrorReason.UNKNOWN, FailureClassifier.NO_STATUS,
                                attempt + 1, "interrupted", e),
                        requestId, elapsedSince(start), attempt);
            } catch (Exception e) {
                long latencyMs = elapsedSince(attemptStart);
                CallOutcome outcome = classifier.classify(e);

                circuitStore.recordResult(functionName, circuitConfig, false);
                recordHealth(outcome, latencyMs);
                metrics.recordCall(functionName, latencyMs, e);

                RetryDecision decision = retryPolicy.shouldRetry(e, attempt, retrySettings);
                if (!decision.shouldRetry()) {
                    logger.error("[{}] {} failed after {} attempt(s): {}",
                            requestId, functionName, attempt + 1, decision.reason());
                    return RpcResult.failure(
                            new RpcInvocationException(functionName, outcome.reason(), outcome.statusCode(),
                                    attempt + 1, decision.reason(), e),
                            requestId, elapsedSince(start), attempt);
                }

                if (retryBudget != null && !retryBudget.tryAcquire()) {
                    logger.error("[{}] {} failed after {} attempt(s): {}",
                            requestId, functionName, attempt + 1, RETRY_BUDGET_EXHAUSTED);
                    metrics.recordRetryBudgetExhausted(functionName);
                    return RpcResult.failure(
                            new RpcInvocationException(functionName, outcome.reason(), outcome.statusCode(),
                                    attempt + 1, RETRY_BUDGET_EXHAUSTED, e),
                            requestId, elapsedSince(start), attempt);
                }

                logger.warn("[{}] {} attempt {} failed ({}), retrying in {}ms",
                        requestId, functionName, attempt + 1, outcome.reason(), decision.delayMs());
                metrics.recordRetry(functionName);
                try {
                    sleeper.sleep(decision.delayMs());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("[{}] {} interrupted during backoff", requestId, functionName);
                    return RpcResult.failure(
                            new RpcInvocationException(functionName, outcome.reason(), outcome.statusCode(),
                                    attempt + 1, "interrupted during backoff", e),
                            requestId, elapsedSince(start), attempt);
                }
                attempt++;
            }
        }
    }

    // Only transport-level failures count against connection health; an HTTP 4xx still proves
    // the server answered.
    private void recordHealth(CallOutcome outcome, long latencyMs) {
        switch (outcome.reason()) {
            case NETWORK_FAILURE, TIMEOUT, SERVER_UNAVAILABLE -> healthMonitor.recordFailure(latencyMs);
            default -> healthMonitor.recordSuccess(latencyMs);
        }
    }

    private void audit(RpcResult<?> result, String functionName) {
        int statusCode = 0;
        int attempts = result.retryCount() + 1;
        if (result.error() instanceof RpcInvocationException failure) {
            statusCode = failure.getStatusCode();
            attempts = failure.getAttempts();
        }
        try {
            auditLogger.record(new AuditLogger.AuditEvent(result.requestId(), functionName, result.isSuccess(),
                    statusCode, attempts, result.durationMs()));
        } catch (RuntimeException e) {
            logger.warn("[{}] Audit logging failed for {}: {}", result.requestId(), functionName, e.toString());
        }
    }

    /**
     * Run several calls concurrently on {@code executor}; results keep the input order.
     */
    public <T> List<RpcResult<T>> batch(List<BatchCall<T>> calls, Executor executor) {
        List<CompletableFuture<RpcResult<T>>> futures = new ArrayList<>(calls.size());
        for (BatchCall<T> entry : calls) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> execute(entry.functionName(), entry.call()), executor));
        }
        List<RpcResult<T>> results = new ArrayList<>(futures.size());
        for (CompletableFuture<RpcResult<T>> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    public void resetCircuit(String functionName) {
        circuitStore.reset(functionName);
        rateLimitGate.reset(functionName);
    }

    public void resetAll() {
        circuitStore.resetAll();
        rateLimitGate.resetAll();
        logger.info("All circuits and rate limiters reset");
    }

    public Map<String, CircuitSnapshot> circuitStatus() {
        return circuitStore.snapshots();
    }

    private static long elapsedSince(long startMs) {
        return System.currentTimeMillis() - startMs;
    }
}
