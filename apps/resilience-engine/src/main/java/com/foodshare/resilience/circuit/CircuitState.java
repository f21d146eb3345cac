package com.foodshare.resilience.circuit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

public enum CircuitState {
    CLOSED("closed", 0),        // Normal operation
    OPEN("open", 1),            // Shedding load (fast-fail)
    HALF_OPEN("halfOpen", 2);   // Probing recovery

    private final String value;
    private final int code;

    CircuitState(String value, int code) {
        this.value = value;
        this.code = code;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Gauge value: 0=closed, 1=open, 2=half-open.
     */
    public int code() {
        return code;
    }

    /**
     * Resolve a wire name, falling back to {@link #CLOSED}.
     */
    @JsonCreator
    public static CircuitState fromValue(@Nullable String value) {
        if (value != null) {
            for (CircuitState state : values()) {
                if (state.value.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value)) {
                    return state;
                }
            }
        }
        return CLOSED;
    }
}
