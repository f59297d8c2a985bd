package io.docflow.serialization.plan;

import static io.docflow.serialization.plan.PlanDefinitionReaderTest.minimalPlan;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docflow.core.exception.PlanLoadException;
import io.docflow.core.plan.PlanDefinition;
import io.docflow.core.plan.PlanLoader;
import io.docflow.core.plan.PlanRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryPlanDefinitionSourceTest {

    @TempDir Path root;

    private void release(String workflowId, String version, String json) throws IOException {
        Path dir = root.resolve("workflows").resolve(workflowId).resolve("releases").resolve(version);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("definition.json"), json);
    }

    private void activeIndex(String json) throws IOException {
        Files.createDirectories(root.resolve("_active"));
        Files.writeString(root.resolve(DirectoryPlanDefinitionSource.ACTIVE_INDEX), json);
    }

    @Test
    void shouldReadOnlyActiveReleases() throws Exception {
        release("scope_doc", "1.0.0", minimalPlan("scope_doc_old"));
        release("scope_doc", "1.1.0", minimalPlan("scope_doc"));
        activeIndex("{\"workflows\": {\"scope_doc\": \"1.1.0\"}}");

        List<PlanDefinition> definitions = new DirectoryPlanDefinitionSource(root).readAll();

        assertThat(definitions).singleElement()
                .satisfies(d -> assertThat(d.raw()).containsEntry("workflow_id", "scope_doc"))
                .satisfies(d -> assertThat(d.source()).contains("1.1.0"));
    }

    @Test
    void shouldReadLooseDefinitionsInNameOrder() throws Exception {
        Files.writeString(root.resolve("b_plan.json"), minimalPlan("b_plan"));
        Files.writeString(root.resolve("a_plan.json"), minimalPlan("a_plan"));
        Files.writeString(root.resolve("notes.txt"), "ignored");

        List<PlanDefinition> definitions = new DirectoryPlanDefinitionSource(root).readAll();

        assertThat(definitions)
                .extracting(d -> d.raw().get("workflow_id"))
                .containsExactly("a_plan", "b_plan");
    }

    @Test
    void shouldFailWhenActiveReleaseIsMissing() throws Exception {
        activeIndex("{\"workflows\": {\"scope_doc\": \"2.0.0\"}}");

        assertThatThrownBy(() -> new DirectoryPlanDefinitionSource(root).readAll())
                .isInstanceOf(PlanLoadException.class)
                .hasMessageContaining("scope_doc@2.0.0");
    }

    @Test
    void shouldFailOnInvalidIndex() throws Exception {
        activeIndex("{not json");

        assertThatThrownBy(() -> new DirectoryPlanDefinitionSource(root).readAll())
                .isInstanceOf(PlanLoadException.class)
                .hasMessageContaining("Invalid active release index");
    }

    @Test
    void shouldFailForMissingDirectory() {
        assertThatThrownBy(() -> new DirectoryPlanDefinitionSource(root.resolve("absent")).readAll())
                .isInstanceOf(PlanLoadException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void shouldFeedRegistry() throws Exception {
        release("scope_doc", "1.0.0", minimalPlan("scope_doc"));
        activeIndex("{\"workflows\": {\"scope_doc\": \"1.0.0\"}}");
        Files.writeString(root.resolve("risk_register.json"), minimalPlan("risk_register"));
        PlanRegistry registry = PlanRegistry.forTesting();

        registry.load(new PlanLoader(), new DirectoryPlanDefinitionSource(root));

        assertThat(registry.getByDocumentType("scope_doc")).isPresent();
        assertThat(registry.getByDocumentType("risk_register")).isPresent();
    }
}
