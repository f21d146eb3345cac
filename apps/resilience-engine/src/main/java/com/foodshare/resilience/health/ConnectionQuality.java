package com.foodshare.resilience.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionQuality {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor"),
    NONE("none");

    private final String value;

    ConnectionQuality(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
