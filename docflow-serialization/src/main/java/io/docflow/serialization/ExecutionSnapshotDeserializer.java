package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.state.ExecutionStatus;
import io.docflow.core.state.NodeExecution;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Reads {@link ExecutionSnapshot} from the snake_case document written by
/// {@link ExecutionSnapshotSerializer}.
///
/// Absent collections become empty; absent booleans become `false`. The four
/// identity fields and `status` are required.
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
class ExecutionSnapshotDeserializer extends StdDeserializer<ExecutionSnapshot> {

    @Serial private static final long serialVersionUID = -1529706411260383263L;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, Integer>> COUNT_MAP = new TypeReference<>() {};

    ExecutionSnapshotDeserializer() {
        super(ExecutionSnapshot.class);
    }

    @Override
    public ExecutionSnapshot deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String statusValue = required(root, "status", ctxt);
        ExecutionStatus status =
                ExecutionStatus.fromWire(statusValue)
                        .orElseThrow(
                                () ->
                                        ctxt.weirdStringException(
                                                statusValue,
                                                ExecutionStatus.class,
                                                "unknown execution status"));

        return new ExecutionSnapshot(
                required(root, "execution_id", ctxt),
                required(root, "workflow_id", ctxt),
                required(root, "subject_id", ctxt),
                textOrNull(root, "document_type"),
                textOrNull(root, "user_id"),
                textOrNull(root, "current_node_id"),
                status,
                readHistory(mapper, root),
                readValue(mapper, root, "retry_counts", COUNT_MAP),
                textOrNull(root, "generating_node_id"),
                textOrNull(root, "gate_outcome"),
                textOrNull(root, "terminal_outcome"),
                textOrNull(root, "thread_id"),
                readValue(mapper, root, "context_state", OBJECT_MAP),
                root.path("pending_user_input").asBoolean(false),
                textOrNull(root, "pending_prompt"),
                readValue(mapper, root, "pending_choices", STRING_LIST),
                readValue(mapper, root, "pending_payload", OBJECT_MAP),
                textOrNull(root, "pending_schema_ref"),
                root.path("escalation_active").asBoolean(false),
                readValue(mapper, root, "escalation_options", STRING_LIST),
                instantOrNull(mapper, root, "created_at"),
                instantOrNull(mapper, root, "updated_at"));
    }

    private List<NodeExecution> readHistory(ObjectMapper mapper, JsonNode root) throws IOException {
        List<NodeExecution> history = new ArrayList<>();
        for (JsonNode entry : root.path("node_history")) {
            history.add(
                    new NodeExecution(
                            entry.path("node_id").asText(),
                            entry.path("outcome").asText(),
                            mapper.treeToValue(entry.get("timestamp"), Instant.class),
                            readValue(mapper, entry, "metadata", OBJECT_MAP)));
        }
        return history;
    }

    private static String required(JsonNode root, String field, DeserializationContext ctxt)
            throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw JsonMappingException.from(ctxt, "Missing field in execution document: " + field);
        }
        return node.asText();
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Instant instantOrNull(ObjectMapper mapper, JsonNode root, String field)
            throws IOException {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : mapper.treeToValue(node, Instant.class);
    }

    private static <T> T readValue(
            ObjectMapper mapper, JsonNode root, String field, TypeReference<T> type)
            throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.readValue(mapper.treeAsTokens(node), type);
    }
}
