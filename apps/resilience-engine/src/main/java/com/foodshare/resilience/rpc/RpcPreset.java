package com.foodshare.resilience.rpc;

import org.springframework.lang.Nullable;

/**
 * Named RPC tuning bundles. Values are a contract shared with the mobile clients.
 */
public enum RpcPreset {
    /** Authentication and account operations. */
    STRICT("strict", new RpcConfig(10, 60_000, 3, 60_000, 1, 1_000, 5_000, 10_000, true)),
    NORMAL("normal", new RpcConfig(60, 60_000, 5, 30_000, 3, 500, 10_000, 15_000, false)),
    /** Search and feed reads returning many rows. */
    BULK("bulk", new RpcConfig(30, 60_000, 5, 30_000, 2, 1_000, 15_000, 30_000, false)),
    REALTIME("realtime", new RpcConfig(300, 60_000, 10, 10_000, 5, 100, 2_000, 5_000, false)),
    SYNC("sync", new RpcConfig(20, 60_000, 3, 60_000, 5, 2_000, 60_000, 60_000, false)),
    /** Aggregated BFF screen endpoints. */
    RELAXED("relaxed", new RpcConfig(120, 60_000, 10, 15_000, 3, 250, 8_000, 20_000, false));

    private final String value;
    private final RpcConfig config;

    RpcPreset(String value, RpcConfig config) {
        this.value = value;
        this.config = config;
    }

    public String value() {
        return value;
    }

    public RpcConfig config() {
        return config;
    }

    /**
     * Resolve a preset name, falling back to {@link #NORMAL}.
     */
    public static RpcPreset fromValue(@Nullable String value) {
        if (value != null) {
            for (RpcPreset preset : values()) {
                if (preset.value.equalsIgnoreCase(value.trim())) {
                    return preset;
                }
            }
        }
        return NORMAL;
    }
}
