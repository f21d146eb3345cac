package com.foodshare.resilience;

import com.foodshare.resilience.backoff.BackoffCalculator;
import com.foodshare.resilience.backoff.BackoffStrategy;
import com.foodshare.resilience.circuit.CircuitSnapshot;
import com.foodshare.resilience.health.ConnectionHealthMonitor;
import com.foodshare.resilience.health.ConnectionHealthResult;
import com.foodshare.resilience.health.ConnectionType;
import com.foodshare.resilience.retry.RetryDecision;
import com.foodshare.resilience.retry.RetryPolicyEvaluator;
import com.foodshare.resilience.rpc.ResilientRpcExecutor;
import com.foodshare.resilience.rpc.RpcConfig;
import com.foodshare.resilience.rpc.RpcFunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-mostly diagnostics for the resilience engine.
 */
@RestController
@RequestMapping("/api/resilience")
public class ResilienceController {
    private static final Logger logger = LoggerFactory.getLogger(ResilienceController.class);

    private final RpcFunctionRegistry registry;
    private final ResilientRpcExecutor executor;
    private final ConnectionHealthMonitor healthMonitor;
    private final BackoffCalculator backoffCalculator;
    private final RetryPolicyEvaluator retryPolicy;

    public ResilienceController(RpcFunctionRegistry registry,
                                ResilientRpcExecutor executor,
                                ConnectionHealthMonitor healthMonitor,
                                BackoffCalculator backoffCalculator,
                                RetryPolicyEvaluator retryPolicy) {
        this.registry = registry;
        this.executor = executor;
        this.healthMonitor = healthMonitor;
        this.backoffCalculator = backoffCalculator;
        this.retryPolicy = retryPolicy;
    }

    @GetMapping("/config/{functionName}")
    public FunctionConfigResponse config(@PathVariable String functionName) {
        RpcConfig config = registry.getConfig(functionName);
        return new FunctionConfigResponse(functionName, registry.isRegistered(functionName),
                config.requiresAuditLog(), config);
    }

    @GetMapping("/circuits")
    public Map<String, CircuitSnapshot> circuits() {
        return executor.circuitStatus();
    }

    @PostMapping("/circuits/{key}/reset")
    public Map<String, String> resetCircuit(@PathVariable String key) {
        logger.info("Resetting circuit {} on request", key);
        executor.resetCircuit(key);
        return Map.of("key", key, "state", "closed");
    }

    @GetMapping("/health")
    public ConnectionHealthResult health(@RequestParam(required = false) String connectionType) {
        if (connectionType == null) {
            return healthMonitor.currentHealth();
        }
        return healthMonitor.currentHealth(ConnectionType.fromValue(connectionType));
    }

    @GetMapping("/backoff")
    public BackoffResponse backoff(@RequestParam int attempt,
                                   @RequestParam(defaultValue = "500") long baseDelayMs,
                                   @RequestParam(defaultValue = "30000") long maxDelayMs,
                                   @RequestParam(required = false) String strategy) {
        BackoffStrategy resolved = BackoffStrategy.fromValue(strategy);
        long delayMs = backoffCalculator.calculateBackoff(attempt, baseDelayMs, maxDelayMs, resolved);
        return new BackoffResponse(attempt, resolved.value(), delayMs);
    }

    @GetMapping("/retry")
    public RetryDecision retry(@RequestParam int statusCode,
                               @RequestParam int attempt,
                               @RequestParam(defaultValue = "3") int maxAttempts) {
        return retryPolicy.shouldRetry(statusCode, attempt, maxAttempts);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(IllegalArgumentException e) {
        return Map.of("error", e.getMessage());
    }

    public record FunctionConfigResponse(String functionName, boolean registered, boolean requiresAuditLog,
                                         RpcConfig config) {
    }

    public record BackoffResponse(int attempt, String strategy, long delayMs) {
    }
}
