package io.docflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.state.NodeExecution;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Writes {@link ExecutionSnapshot} as a snake_case JSON document.
///
/// Null scalar fields are omitted; collections are always written. Node history
/// entries are written in order as `{node_id, outcome, timestamp, metadata}`.
///
/// @implNote Package-private. Registered by {@link DocflowJacksonModule}.
/// @see ExecutionSnapshotDeserializer for the inverse operation
class ExecutionSnapshotSerializer extends StdSerializer<ExecutionSnapshot> {

    @Serial private static final long serialVersionUID = 7718062518573931050L;

    ExecutionSnapshotSerializer() {
        super(ExecutionSnapshot.class);
    }

    @Override
    public void serialize(ExecutionSnapshot s, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("execution_id", s.executionId());
        gen.writeStringField("workflow_id", s.workflowId());
        gen.writeStringField("subject_id", s.subjectId());
        writeIfNotNull(gen, "document_type", s.documentType());
        writeIfNotNull(gen, "user_id", s.userId());
        writeIfNotNull(gen, "current_node_id", s.currentNodeId());
        gen.writeStringField("status", s.status().wireValue());

        writeHistory(gen, provider, s.nodeHistory());
        provider.defaultSerializeField("retry_counts", s.retryCounts(), gen);

        writeIfNotNull(gen, "generating_node_id", s.generatingNodeId());
        writeIfNotNull(gen, "gate_outcome", s.gateOutcome());
        writeIfNotNull(gen, "terminal_outcome", s.terminalOutcome());
        writeIfNotNull(gen, "thread_id", s.threadId());
        provider.defaultSerializeField("context_state", s.contextState(), gen);

        gen.writeBooleanField("pending_user_input", s.pendingUserInput());
        writeIfNotNull(gen, "pending_prompt", s.pendingPrompt());
        if (s.pendingChoices() != null) {
            provider.defaultSerializeField("pending_choices", s.pendingChoices(), gen);
        }
        if (s.pendingPayload() != null) {
            provider.defaultSerializeField("pending_payload", s.pendingPayload(), gen);
        }
        writeIfNotNull(gen, "pending_schema_ref", s.pendingSchemaRef());

        gen.writeBooleanField("escalation_active", s.escalationActive());
        provider.defaultSerializeField("escalation_options", s.escalationOptions(), gen);

        if (s.createdAt() != null) {
            provider.defaultSerializeField("created_at", s.createdAt(), gen);
        }
        if (s.updatedAt() != null) {
            provider.defaultSerializeField("updated_at", s.updatedAt(), gen);
        }
        gen.writeEndObject();
    }

    private void writeHistory(
            JsonGenerator gen, SerializerProvider provider, List<NodeExecution> history)
            throws IOException {
        gen.writeArrayFieldStart("node_history");
        for (NodeExecution entry : history) {
            gen.writeStartObject();
            gen.writeStringField("node_id", entry.nodeId());
            gen.writeStringField("outcome", entry.outcome());
            provider.defaultSerializeField("timestamp", entry.timestamp(), gen);
            provider.defaultSerializeField("metadata", entry.metadata(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }

    private static void writeIfNotNull(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
