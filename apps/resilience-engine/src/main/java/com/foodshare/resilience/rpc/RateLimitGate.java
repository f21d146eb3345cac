package com.foodshare.resilience.rpc;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Client-side request envelopes: one global limiter plus one per RPC function.
 *
 * Limiters never block: a request either takes a permit now or is rejected with the time
 * until the next refresh.
 */
public class RateLimitGate {

    public static final String GLOBAL = "global";

    private final RateLimiterRegistry registry;
    private final RateLimiterConfig globalConfig;
    private final Set<String> functionNames = ConcurrentHashMap.newKeySet();

    public RateLimitGate(int globalMaxRequests, long globalWindowMs) {
        this.globalConfig = limiterConfig(globalMaxRequests, globalWindowMs);
        this.registry = RateLimiterRegistry.of(globalConfig);
    }

    /**
     * Take a permit from the per-function and the global envelope.
     *
     * A request turned away by its own function envelope leaves the global envelope untouched,
     * so one hot function cannot starve the others.
     *
     * @throws RateLimitExceededException if either envelope is exhausted
     */
    public void acquire(String functionName, RpcConfig config) {
        RateLimiter global = registry.rateLimiter(GLOBAL, globalConfig);
        if (global.getMetrics().getAvailablePermissions() <= 0) {
            throw new RateLimitExceededException(functionName, waitTimeMs(global));
        }

        RateLimiter limiter = limiterFor(functionName, config);
        if (!limiter.acquirePermission()) {
            throw new RateLimitExceededException(functionName, waitTimeMs(limiter));
        }

        // Concurrent callers may have drained the global envelope since the check above
        if (!global.acquirePermission()) {
            throw new RateLimitExceededException(functionName, waitTimeMs(global));
        }
    }

    private RateLimiter limiterFor(String functionName, RpcConfig config) {
        RateLimiterConfig wanted = limiterConfig(config.maxRequests(), config.windowMs());
        RateLimiter limiter = registry.rateLimiter(functionName, wanted);

        // Config was replaced at runtime: start a fresh envelope
        RateLimiterConfig current = limiter.getRateLimiterConfig();
        if (current.getLimitForPeriod() != wanted.getLimitForPeriod()
                || !current.getLimitRefreshPeriod().equals(wanted.getLimitRefreshPeriod())) {
            registry.remove(functionName);
            limiter = registry.rateLimiter(functionName, wanted);
        }
        functionNames.add(functionName);
        return limiter;
    }

    /**
     * Available permits per envelope, global included.
     */
    public Map<String, Integer> availablePermissions() {
        Map<String, Integer> status = new TreeMap<>();
        status.put(GLOBAL, registry.rateLimiter(GLOBAL, globalConfig).getMetrics().getAvailablePermissions());
        for (String name : functionNames) {
            registry.find(name).ifPresent(limiter ->
                    status.put(name, limiter.getMetrics().getAvailablePermissions()));
        }
        return status;
    }

    public void reset(String functionName) {
        registry.remove(functionName);
        functionNames.remove(functionName);
    }

    public void resetAll() {
        for (String name : functionNames) {
            registry.remove(name);
        }
        functionNames.clear();
        registry.remove(GLOBAL);
    }

    private static RateLimiterConfig limiterConfig(int maxRequests, long windowMs) {
        return RateLimiterConfig.custom()
                .limitForPeriod(maxRequests)
                .limitRefreshPeriod(Duration.ofMillis(windowMs))
                .timeoutDuration(Duration.ZERO)
                .build();
    }

    private static long waitTimeMs(RateLimiter limiter) {
        if (limiter instanceof AtomicRateLimiter atomic) {
            long nanos = atomic.getDetailedMetrics().getNanosToWait();
            return Math.max(0, TimeUnit.NANOSECONDS.toMillis(nanos));
        }
        return limiter.getRateLimiterConfig().getLimitRefreshPeriod().toMillis();
    }
}
