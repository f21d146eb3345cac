package com.foodshare.resilience.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionStatus {
    HEALTHY("healthy", "Connection is healthy"),
    DEGRADED("degraded", "Consider deferring non-critical requests"),
    UNSTABLE("unstable", "Defer background sync and bulk requests"),
    DISCONNECTED("disconnected", "Switch to offline mode");

    private final String value;
    private final String recommendation;

    ConnectionStatus(String value, String recommendation) {
        this.value = value;
        this.recommendation = recommendation;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String recommendation() {
        return recommendation;
    }
}
