package io.docflow.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.docflow.core.execution.ScriptedNodeExecutor;
import io.docflow.core.execution.executor.NodeResult;
import io.docflow.core.execution.executor.TaskNodeExecutor;
import io.docflow.core.llm.CompletionService;
import io.docflow.core.llm.DocumentParser;
import io.docflow.core.llm.PromptLoader;
import io.docflow.core.plan.PlanRegistry;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ExecutionState;
import io.docflow.core.state.ExecutionStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocflowFactoryTest {

    @Mock private CompletionService completionService;
    @Mock private PromptLoader promptLoader;
    @Mock private DocumentParser documentParser;

    @Test
    void shouldRegisterBuiltInExecutorsWithoutCompletionService() {
        try (DocflowEnvironment env = DocflowFactory.createEnvironment()) {
            var executors = env.getNodeExecutorRegistry();

            assertThat(executors.hasExecutor(NodeType.GATE)).isTrue();
            assertThat(executors.hasExecutor(NodeType.END)).isTrue();
            assertThat(executors.hasExecutor(NodeType.QA)).isTrue();
            assertThat(executors.hasExecutor(NodeType.INTAKE_GATE)).isTrue();
            assertThat(executors.hasExecutor(NodeType.TASK)).isFalse();
            assertThat(executors.hasExecutor(NodeType.PGC)).isFalse();
            assertThat(env.getPlanRegistry().size()).isZero();
        }
    }

    @Test
    void shouldRegisterGeneratingExecutorsWithCompletionService() {
        try (DocflowEnvironment env =
                DocflowFactory.builder()
                        .completionService(completionService, promptLoader, documentParser)
                        .build()) {
            var executors = env.getNodeExecutorRegistry();

            assertThat(executors.getExecutor(NodeType.TASK))
                    .get()
                    .isInstanceOf(TaskNodeExecutor.class);
            assertThat(executors.getExecutor(NodeType.PGC))
                    .get()
                    .isInstanceOf(TaskNodeExecutor.class);
        }
    }

    @Test
    void shouldPreferCustomExecutorOverBuiltIn() {
        ScriptedNodeExecutor customTask = ScriptedNodeExecutor.of(NodeType.TASK, NodeResult.SUCCESS);

        try (DocflowEnvironment env =
                DocflowFactory.builder()
                        .completionService(completionService, promptLoader, documentParser)
                        .nodeExecutor(customTask)
                        .build()) {
            assertThat(env.getNodeExecutorRegistry().getExecutor(NodeType.TASK)).containsSame(customTask);
        }
    }

    @Test
    void shouldRunPlanThroughWiredEnvironment() throws Exception {
        PlanRegistry registry = PlanRegistry.forTesting();
        registry.register(TestPlans.discoveryPlan());

        try (DocflowEnvironment env =
                DocflowFactory.builder()
                        .config(DocflowConfig.builder().maxSteps(20).build())
                        .planRegistry(registry)
                        .nodeExecutor(ScriptedNodeExecutor.of(NodeType.TASK, NodeResult.SUCCESS))
                        .nodeExecutor(ScriptedNodeExecutor.of(NodeType.QA, NodeResult.SUCCESS))
                        .build()) {
            var executor = env.getPlanExecutor();
            String id =
                    executor.startExecution("proj-1", TestPlans.DISCOVERY_WORKFLOW, null).getExecutionId();

            ExecutionState paused = executor.runToCompletionOrPause(id);
            ExecutionState done = executor.submitUserInput(id, null, "qualified");

            assertThat(paused.getCurrentNodeId()).isEqualTo("review_gate");
            assertThat(done.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(env.getStateRepository().findByExecutionId(id)).isPresent();
        }
    }
}
