package io.docflow.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.docflow.core.llm.ChatMessage;
import io.docflow.core.llm.CompletionException;
import io.docflow.core.llm.CompletionOptions;
import io.docflow.core.llm.CompletionService;
import io.docflow.core.llm.DocumentParser;
import io.docflow.core.llm.PromptLoader;
import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ContextState;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.state.ExecutionState;
import java.io.FileNotFoundException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskNodeExecutorTest {

    @Mock private CompletionService completionService;
    @Mock private PromptLoader promptLoader;
    @Mock private DocumentParser documentParser;
    @Captor private ArgumentCaptor<List<ChatMessage>> messages;
    @Captor private ArgumentCaptor<CompletionOptions> options;

    private final ExecutionSnapshot state =
            ExecutionSnapshot.from(
                    ExecutionState.builder()
                            .executionId("exec-1")
                            .workflowId("wf")
                            .subjectId("proj-1")
                            .build());

    private final Node task =
            Node.builder()
                    .nodeId("generate")
                    .type(NodeType.TASK)
                    .taskRef("project_discovery_v1")
                    .produces("project_discovery")
                    .build();

    private TaskNodeExecutor executor(NodeType type) {
        return new TaskNodeExecutor(type, completionService, promptLoader, documentParser);
    }

    @Test
    void shouldProduceDocumentOnSuccess() throws Exception {
        when(promptLoader.loadTaskPrompt("project_discovery_v1")).thenReturn("You write discovery docs.");
        when(completionService.complete(anyList(), eq("You write discovery docs."), any()))
                .thenReturn("{\"title\":\"Alpha\"}");
        when(documentParser.parse("{\"title\":\"Alpha\"}", "project_discovery"))
                .thenReturn(Map.of("title", "Alpha"));
        NodeContext context = NodeContext.builder().executionId("exec-1").build();

        NodeResult result = executor(NodeType.TASK).execute(task, context, state);

        assertThat(result.getOutcome()).isEqualTo(NodeResult.SUCCESS);
        assertThat(result.getProducedDocument()).containsEntry("title", "Alpha");
        assertThat(result.getMetadata()).containsEntry("produces", "project_discovery");
        assertThat(context.getDocumentContent()).containsKey("project_discovery");
    }

    @Test
    void shouldAssembleUserMessageFromGovernedContext() throws Exception {
        when(promptLoader.loadTaskPrompt(any())).thenReturn("prompt");
        when(completionService.complete(messages.capture(), any(), options.capture())).thenReturn("{}");
        when(documentParser.parse(any(), any())).thenReturn(Map.of());
        ContextState contextState =
                ContextState.of(
                        Map.of(
                                "user_input", "A booking app for dentists",
                                "pgc_invariants",
                                        List.of(
                                                Map.of(
                                                        "id", "PLATFORM",
                                                        "user_answer_label", "Web only",
                                                        "binding_source", "priority")),
                                "qa_feedback",
                                        Map.of(
                                                "issues",
                                                List.of(Map.of("type", "semantic", "message", "Scope is vague")))));
        NodeContext context =
                NodeContext.builder()
                        .executionId("exec-1")
                        .documentType("project_discovery")
                        .contextState(contextState)
                        .build();

        executor(NodeType.TASK).execute(task, context, state);

        String prompt = messages.getValue().get(messages.getValue().size() - 1).content();
        assertThat(prompt)
                .contains("## User Request\nA booking app for dentists")
                .contains("- PLATFORM: Web only")
                .contains("1. Scope is vague");
        assertThat(options.getValue().nodeId()).isEqualTo("generate");
        assertThat(options.getValue().role()).isEqualTo("Document Generator");
    }

    @Test
    void shouldReportCompletionFailureAsFailedOutcome() throws Exception {
        when(promptLoader.loadTaskPrompt(any())).thenReturn("prompt");
        when(completionService.complete(anyList(), any(), any()))
                .thenThrow(new CompletionException("rate limited"));

        NodeResult result = executor(NodeType.TASK).execute(task, NodeContext.builder().build(), state);

        assertThat(result.getOutcome()).isEqualTo(NodeResult.FAILED);
        assertThat(result.getMetadata()).containsEntry("reason", "rate limited");
    }

    @Test
    void shouldReportMissingPromptAsFailedOutcome() throws Exception {
        when(promptLoader.loadTaskPrompt(any())).thenThrow(new FileNotFoundException("no prompt"));

        NodeResult result = executor(NodeType.TASK).execute(task, NodeContext.builder().build(), state);

        assertThat(result.getOutcome()).isEqualTo(NodeResult.FAILED);
    }

    @Test
    void shouldFailWithoutTaskRef() {
        Node bare = Node.builder().nodeId("generate").type(NodeType.TASK).build();

        NodeResult result = executor(NodeType.TASK).execute(bare, NodeContext.builder().build(), state);

        assertThat(result.getOutcome()).isEqualTo(NodeResult.FAILED);
    }

    @Test
    void shouldPauseClarificationNodeWithQuestionPayload() throws Exception {
        Node pgc =
                Node.builder()
                        .nodeId("clarify")
                        .type(NodeType.PGC)
                        .taskRef("clarify_v1")
                        .produces("clarification_questions")
                        .build();
        Map<String, Object> questions =
                Map.of(
                        "schema_version", "clarification_question_set.v3",
                        "questions", List.of(Map.of("id", "Q1", "text", "Who are the users?")));
        when(promptLoader.loadTaskPrompt("clarify_v1")).thenReturn("prompt");
        when(completionService.complete(anyList(), any(), any())).thenReturn("{}");
        when(documentParser.parse(any(), any())).thenReturn(questions);

        NodeResult result = executor(NodeType.PGC).execute(pgc, NodeContext.builder().build(), state);

        assertThat(result.isRequiresUserInput()).isTrue();
        assertThat(result.getOutcome()).isEqualTo(NodeResult.NEEDS_USER_INPUT);
        assertThat(result.getPayload()).isEqualTo(questions);
        assertThat(result.getSchemaRef()).isEqualTo("schema://clarification_question_set.v3");
        assertThat(result.getUserPrompt()).contains("1. Who are the users?");
        verify(completionService).complete(anyList(), any(), options.capture());
        assertThat(options.getValue().role()).isEqualTo("PGC Generator");
    }

    @Test
    void shouldRejectNonGeneratingNodeType() {
        assertThatThrownBy(() -> executor(NodeType.QA)).isInstanceOf(IllegalArgumentException.class);
    }
}
