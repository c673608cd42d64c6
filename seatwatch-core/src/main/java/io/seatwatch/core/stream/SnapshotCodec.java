package io.seatwatch.core.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.seatwatch.api.stream.Snapshot;

import java.io.UncheckedIOException;

/**
 * JSON form of snapshots and other wire objects: snake_case names, ISO-8601 instants.
 */
public final class SnapshotCodec {

    private final ObjectMapper objectMapper;

    public SnapshotCodec() {
        this.objectMapper = newObjectMapper();
    }

    /**
     * Mapper configured for the wire format, shared with the HTTP layer.
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    public String encode(Snapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize snapshot " + snapshot.sequence(), e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
