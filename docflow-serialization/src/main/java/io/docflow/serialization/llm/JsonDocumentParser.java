package io.docflow.serialization.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docflow.core.llm.DocumentParser;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Jackson-based {@link DocumentParser}.
///
/// Accepts a ```json fenced block or a response that starts with `{`. Anything else,
/// including malformed JSON, becomes a raw document:
///
/// ```json
/// {"type": "<produces or unknown>", "content": "<response>", "raw": true}
/// ```
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is.
public class JsonDocumentParser implements DocumentParser {

    private static final Logger logger = Logger.getLogger(JsonDocumentParser.class.getName());

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonDocumentParser() {
        this(new ObjectMapper());
    }

    public JsonDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Map<String, Object> parse(String response, String produces) {
        Objects.requireNonNull(response, "response must not be null");
        if (JsonResponses.looksLikeJsonObject(response)) {
            try {
                Map<String, Object> parsed =
                        objectMapper.readValue(JsonResponses.stripCodeFences(response), OBJECT_MAP);
                if (parsed != null) {
                    return parsed;
                }
            } catch (JsonProcessingException e) {
                logger.fine(() -> "Response is not valid JSON: " + e.getOriginalMessage());
            }
        }
        logger.warning("Falling back to raw content for produces=" + produces);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("type", produces != null ? produces : "unknown");
        raw.put("content", response);
        raw.put("raw", true);
        return raw;
    }
}
