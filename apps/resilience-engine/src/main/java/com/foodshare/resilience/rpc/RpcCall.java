package com.foodshare.resilience.rpc;

/**
 * One attempt of a remote call, supplied by the transport layer.
 *
 * Implementations report HTTP failures by throwing {@link RpcStatusException}; I/O failures
 * surface as {@link java.io.IOException}s.
 */
@FunctionalInterface
public interface RpcCall<T> {
    T invoke() throws Exception;
}
