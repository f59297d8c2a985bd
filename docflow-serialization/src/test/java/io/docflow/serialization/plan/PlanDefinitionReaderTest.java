package io.docflow.serialization.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docflow.core.exception.PlanLoadException;
import io.docflow.core.plan.PlanDefinition;
import io.docflow.core.plan.PlanLoader;
import io.docflow.core.plan.WorkflowPlan;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlanDefinitionReaderTest {

    static final String MINIMAL_PLAN =
            "{\"workflow_id\": \"%s\", \"entry_node_ids\": [\"generate\"],"
                    + " \"nodes\": ["
                    + "  {\"node_id\": \"generate\", \"type\": \"task\", \"task_ref\": \"t_v1\", \"produces\": \"%s\"},"
                    + "  {\"node_id\": \"end_done\", \"type\": \"end\", \"terminal_outcome\": \"stabilized\"}],"
                    + " \"edges\": [{\"edge_id\": \"e1\", \"from_node_id\": \"generate\","
                    + "  \"outcome\": \"success\", \"to_node_id\": \"end_done\"}]}";

    static String minimalPlan(String workflowId) {
        return String.format(MINIMAL_PLAN, workflowId, workflowId);
    }

    private final PlanDefinitionReader reader = new PlanDefinitionReader();

    @Test
    void shouldReadDefinitionThatLoads() throws Exception {
        PlanDefinition definition = reader.read("inline.json", minimalPlan("scope_doc"));

        WorkflowPlan plan = new PlanLoader().load(definition);

        assertThat(definition.source()).isEqualTo("inline.json");
        assertThat(definition.raw()).containsEntry("workflow_id", "scope_doc");
        assertThat(plan.getNodes()).hasSize(2);
    }

    @Test
    void shouldReadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("scope_doc.json");
        Files.writeString(file, minimalPlan("scope_doc"));

        PlanDefinition definition = reader.read(file);

        assertThat(definition.source()).isEqualTo(file.toString());
        assertThat((List<?>) definition.raw().get("nodes")).hasSize(2);
    }

    @Test
    void shouldReadFromStream() throws Exception {
        byte[] bytes = minimalPlan("scope_doc").getBytes(StandardCharsets.UTF_8);

        PlanDefinition definition = reader.read("stream", new ByteArrayInputStream(bytes));

        assertThat(definition.raw()).containsKey("edges");
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> reader.read("broken.json", "{\"workflow_id\": "))
                .isInstanceOf(PlanLoadException.class)
                .hasMessageContaining("Invalid plan JSON")
                .satisfies(e -> assertThat(((PlanLoadException) e).getSource()).isEqualTo("broken.json"));
    }

    @Test
    void shouldRejectMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.read(dir.resolve("absent.json")))
                .isInstanceOf(PlanLoadException.class)
                .hasMessageContaining("Cannot read plan definition");
    }
}
