package com.foodshare.resilience.retry;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Caps the number of retries spent within a sliding time window, so a burst of failures
 * across many calls cannot multiply load on a struggling backend.
 *
 * One budget is shared by every call that should draw from the same allowance; pass it to
 * {@link com.foodshare.resilience.rpc.ResilientRpcExecutor#execute(String,
 * com.foodshare.resilience.rpc.RpcCall, com.foodshare.resilience.rpc.RpcConfig, RetryBudget)}.
 * Thread-safe.
 */
public class RetryBudget {

    public static final int DEFAULT_MAX_RETRIES = 10;
    public static final long DEFAULT_WINDOW_MS = 60_000;

    private final int maxRetries;
    private final long windowMs;
    private final Clock clock;
    private final Deque<Long> retries = new ArrayDeque<>();

    public RetryBudget(Clock clock) {
        this(DEFAULT_MAX_RETRIES, DEFAULT_WINDOW_MS, clock);
    }

    public RetryBudget(int maxRetries, long windowMs, Clock clock) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be > 0: " + windowMs);
        }
        this.maxRetries = maxRetries;
        this.windowMs = windowMs;
        this.clock = clock;
    }

    public synchronized boolean canRetry() {
        prune(clock.millis());
        return retries.size() < maxRetries;
    }

    public synchronized void recordRetry() {
        long now = clock.millis();
        prune(now);
        retries.addLast(now);
    }

    /**
     * Check and record in one step. Returns false, recording nothing, when the budget is spent.
     */
    public synchronized boolean tryAcquire() {
        long now = clock.millis();
        prune(now);
        if (retries.size() >= maxRetries) {
            return false;
        }
        retries.addLast(now);
        return true;
    }

    public synchronized int remainingRetries() {
        prune(clock.millis());
        return Math.max(0, maxRetries - retries.size());
    }

    public synchronized void reset() {
        retries.clear();
    }

    public int maxRetries() {
        return maxRetries;
    }

    public long windowMs() {
        return windowMs;
    }

    private void prune(long nowMs) {
        while (!retries.isEmpty() && retries.peekFirst() <= nowMs - windowMs) {
            retries.pollFirst();
        }
    }
}
