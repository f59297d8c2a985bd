package io.docflow.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.docflow.core.TestPlans;
import io.docflow.core.plan.WorkflowPlan;
import io.docflow.core.state.NodeExecution;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeneratingNodeResolverTest {

    private final WorkflowPlan plan = TestPlans.discoveryPlan();

    private static NodeExecution entry(String nodeId, String outcome) {
        return new NodeExecution(nodeId, outcome, Instant.now(), null);
    }

    @Test
    void shouldFindMostRecentTaskExecution() {
        List<NodeExecution> history =
                List.of(entry("generate", "success"), entry("qa", "failed"));

        assertThat(GeneratingNodeResolver.findGeneratingNode(history, plan)).contains("generate");
    }

    @Test
    void shouldSkipNodesMissingFromPlan() {
        List<NodeExecution> history =
                List.of(entry("generate", "success"), entry("legacy_task", "success"), entry("qa", "failed"));

        assertThat(GeneratingNodeResolver.findGeneratingNode(history, plan)).contains("generate");
    }

    @Test
    void shouldReturnEmptyWithoutTaskInHistory() {
        assertThat(GeneratingNodeResolver.findGeneratingNode(List.of(entry("qa", "failed")), plan))
                .isEmpty();
        assertThat(GeneratingNodeResolver.findGeneratingNode(List.of(), plan)).isEmpty();
    }
}
