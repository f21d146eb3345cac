package com.foodshare.resilience.circuit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * JSON form of {@link CircuitSnapshot}, the blob callers persist between evaluations.
 */
public class CircuitSnapshotCodec {
    private static final Logger logger = LoggerFactory.getLogger(CircuitSnapshotCodec.class);

    private final ObjectMapper mapper;

    public CircuitSnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Decode a serialized snapshot. Empty when the input is absent or unreadable.
     */
    public Optional<CircuitSnapshot> decode(@Nullable String serialized) {
        if (serialized == null || serialized.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(serialized, CircuitSnapshot.class));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable circuit state, starting closed: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public String encode(CircuitSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Circuit snapshot is not serializable", e);
        }
    }
}
