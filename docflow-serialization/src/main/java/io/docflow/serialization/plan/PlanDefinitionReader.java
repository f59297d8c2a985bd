package io.docflow.serialization.plan;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docflow.core.exception.PlanLoadException;
import io.docflow.core.plan.PlanDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/// Reads JSON plan definitions into raw maps for the validator.
///
/// Only parses; validation and model building stay with
/// {@link io.docflow.core.plan.PlanLoader}.
public class PlanDefinitionReader {

    private static final TypeReference<Map<String, Object>> RAW = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public PlanDefinitionReader() {
        this(new ObjectMapper());
    }

    public PlanDefinitionReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /// @throws PlanLoadException if the file cannot be read or is not a JSON object
    public PlanDefinition read(Path file) throws PlanLoadException {
        String source = file.toString();
        try (InputStream in = Files.newInputStream(file)) {
            return read(source, in);
        } catch (IOException e) {
            throw new PlanLoadException(source, "Cannot read plan definition: " + e.getMessage(), e);
        }
    }

    /// @throws PlanLoadException if the stream is not a JSON object
    public PlanDefinition read(String source, InputStream in) throws PlanLoadException {
        try {
            Map<String, Object> raw = objectMapper.readValue(in, RAW);
            if (raw == null) {
                throw new PlanLoadException(source, "Plan definition is empty", null);
            }
            return new PlanDefinition(source, raw);
        } catch (IOException e) {
            throw new PlanLoadException(source, "Invalid plan JSON: " + e.getMessage(), e);
        }
    }

    /// @throws PlanLoadException if the text is not a JSON object
    public PlanDefinition read(String source, String json) throws PlanLoadException {
        try {
            return new PlanDefinition(source, objectMapper.readValue(json, RAW));
        } catch (IOException e) {
            throw new PlanLoadException(source, "Invalid plan JSON: " + e.getMessage(), e);
        }
    }
}
