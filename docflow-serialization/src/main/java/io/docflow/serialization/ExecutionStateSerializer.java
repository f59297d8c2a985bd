package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.state.ExecutionState;

/// Serializes execution state to and from JSON.
///
/// {@snippet :
/// String json = ExecutionStateSerializer.toJson(state);
/// ExecutionState restored = ExecutionStateSerializer.fromJson(json);
/// }
///
/// The round trip preserves history order, retry counts, pause and escalation
/// fields, and timestamps.
///
/// @implNote Thread-safe. Uses a shared mapper configured by {@link #createMapper()}.
public final class ExecutionStateSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ExecutionStateSerializer() {}

    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ExecutionState state) {
        try {
            return MAPPER.writeValueAsString(ExecutionSnapshot.from(state));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize execution " + state.getExecutionId() + ": " + e.getMessage(),
                    e);
        }
    }

    /// @throws IllegalArgumentException if the JSON is not a valid execution document
    public static ExecutionState fromJson(String json) {
        try {
            return MAPPER.readValue(json, ExecutionSnapshot.class).toState();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize execution: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for docflow documents.
    ///
    /// Registers:
    /// - `DocflowJacksonModule` for execution snapshots and statuses
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new DocflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
