package com.foodshare.resilience.rpc;

import org.springframework.lang.Nullable;

import java.util.function.Function;

/**
 * Outcome of a call through {@link ResilientRpcExecutor}, with request metadata.
 *
 * @param retryCount attempts made after the first one
 */
public record RpcResult<T>(
    @Nullable T data,
    @Nullable RpcException error,
    String requestId,
    long durationMs,
    int retryCount
) {
    public static <T> RpcResult<T> success(@Nullable T data, String requestId, long durationMs, int retryCount) {
        return new RpcResult<>(data, null, requestId, durationMs, retryCount);
    }

    public static <T> RpcResult<T> failure(RpcException error, String requestId, long durationMs, int retryCount) {
        return new RpcResult<>(null, error, requestId, durationMs, retryCount);
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Nullable
    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return data;
    }

    @Nullable
    public T getOrNull() {
        return data;
    }

    public <R> RpcResult<R> map(Function<? super T, ? extends R> transform) {
        R mapped = data == null ? null : transform.apply(data);
        return new RpcResult<>(mapped, error, requestId, durationMs, retryCount);
    }
}
