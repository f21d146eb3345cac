package com.foodshare.resilience.rpc;

/**
 * Waits out a backoff delay between attempts.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
