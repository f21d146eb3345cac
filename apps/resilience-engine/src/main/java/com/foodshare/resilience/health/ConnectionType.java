package com.foodshare.resilience.health;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

public enum ConnectionType {
    WIFI("wifi"),
    CELLULAR("cellular"),
    ETHERNET("ethernet"),
    UNKNOWN("unknown"),
    NONE("none");

    private final String value;

    ConnectionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Absent or blank input means no connection; unrecognized names mean {@link #UNKNOWN}.
     */
    public static ConnectionType fromValue(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        for (ConnectionType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
