package io.docflow.core.execution;

import static io.docflow.core.TestPlans.edge;
import static io.docflow.core.TestPlans.list;
import static io.docflow.core.TestPlans.map;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;

import io.docflow.core.TestPlans;
import io.docflow.core.exception.ExecutionNotFoundException;
import io.docflow.core.exception.InvalidEscalationChoiceException;
import io.docflow.core.exception.MaxStepsExceededException;
import io.docflow.core.exception.MissingUserInputException;
import io.docflow.core.exception.NoActiveEscalationException;
import io.docflow.core.exception.NodeExecutionException;
import io.docflow.core.exception.NotPausedException;
import io.docflow.core.exception.PlanNotFoundException;
import io.docflow.core.execution.executor.DefaultNodeExecutorRegistry;
import io.docflow.core.execution.executor.NodeResult;
import io.docflow.core.plan.PlanRegistry;
import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ContextState;
import io.docflow.core.state.ExecutionState;
import io.docflow.core.state.ExecutionStatus;
import io.docflow.core.state.InMemoryExecutionStateRepository;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PlanExecutorTest {

    private static final String SUBJECT = "proj-1";

    @Mock private ExecutionListener listener;

    private PlanRegistry planRegistry;
    private InMemoryExecutionStateRepository repository;
    private DefaultNodeExecutorRegistry executors;
    private InMemoryOutcomeRecorder recorder;
    private PlanExecutor executor;

    @BeforeEach
    void setUp() {
        planRegistry = PlanRegistry.forTesting();
        planRegistry.register(TestPlans.discoveryPlan());
        planRegistry.register(TestPlans.consentPlan());
        repository = new InMemoryExecutionStateRepository();
        executors = new DefaultNodeExecutorRegistry();
        executors.register(ScriptedNodeExecutor.of(NodeType.TASK, NodeResult.SUCCESS));
        recorder = new InMemoryOutcomeRecorder();
        executor = new PlanExecutor(planRegistry, repository, executors, recorder, listener, 100);
    }

    private String startDiscovery() throws Exception {
        return executor.startExecution(SUBJECT, TestPlans.DISCOVERY_WORKFLOW, Map.of()).getExecutionId();
    }

    private void qaOutcomes(String... outcomes) {
        executors.register(ScriptedNodeExecutor.of(NodeType.QA, outcomes));
    }

    // ---- start -------------------------------------------------------------

    @Nested
    class Start {

        @Test
        void shouldCreatePendingExecutionAtEntryNode() throws Exception {
            ExecutionState state =
                    executor.startExecution(
                            SUBJECT, TestPlans.DISCOVERY_WORKFLOW, Map.of("user_input", "Build a CRM"));

            assertThat(state.getExecutionId()).startsWith("exec-").hasSize(17);
            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.PENDING);
            assertThat(state.getCurrentNodeId()).isEqualTo("generate");
            assertThat(state.getContextState().userInput()).contains("Build a CRM");
            assertThat(repository.findByExecutionId(state.getExecutionId())).isPresent();
            verify(listener).onExecutionStarted(any());
        }

        @Test
        void shouldReuseActiveExecutionForSameSubject() throws Exception {
            String first = startDiscovery();

            String second = startDiscovery();

            assertThat(second).isEqualTo(first);
            assertThat(executor.listExecutions(null, 10)).hasSize(1);
        }

        @Test
        void shouldStartFreshExecutionOnceThePreviousOneFinished() throws Exception {
            executors.register(ScriptedNodeExecutor.of(NodeType.TASK, NodeResult.FAILED));
            String first = startDiscovery();
            executor.runToCompletionOrPause(first);

            String second = startDiscovery();

            assertThat(second).isNotEqualTo(first);
        }

        @Test
        void shouldRejectUnknownDocumentType() {
            assertThatThrownBy(() -> executor.startExecution(SUBJECT, "unknown_doc", null))
                    .isInstanceOf(PlanNotFoundException.class);
        }

        @Test
        void shouldRejectUngovernedInitialContext() {
            assertThatThrownBy(
                            () ->
                                    executor.startExecution(
                                            SUBJECT,
                                            TestPlans.DISCOVERY_WORKFLOW,
                                            Map.of("transcript", "...")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ---- QA retry loop -----------------------------------------------------

    @Nested
    class RetryLoop {

        @Test
        void shouldRetryOnceThenPauseAtGateAndCompleteWithBothOutcomes() throws Exception {
            qaOutcomes(NodeResult.FAILED, NodeResult.SUCCESS);
            String id = startDiscovery();

            ExecutionState paused = executor.runToCompletionOrPause(id);

            assertThat(paused.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(paused.getCurrentNodeId()).isEqualTo("review_gate");
            assertThat(paused.getPendingChoices()).containsExactly("qualified", "not_ready");
            assertThat(paused.getRetryCount("generate")).isEqualTo(1);
            assertThat(paused.getRetryCount("qa")).isZero();
            assertThat(paused.getNodeHistory())
                    .extracting(e -> e.nodeId() + ":" + e.outcome())
                    .containsExactly(
                            "generate:success",
                            "qa:failed",
                            "generate:success",
                            "qa:success",
                            "review_gate:needs_user_input");

            ExecutionState done = executor.submitUserInput(id, null, "qualified");

            assertThat(done.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(done.getTerminalOutcome()).isEqualTo("stabilized");
            assertThat(done.getGateOutcome()).isEqualTo("qualified");
            assertThat(done.getCurrentNodeId()).isEqualTo("end_stabilized");
            assertThat(done.getContextState().gateAnswer("review_gate")).contains("qualified");
            assertThat(recorder.getOutcomes())
                    .singleElement()
                    .satisfies(
                            o -> {
                                assertThat(o.mappingConsistent()).isTrue();
                                assertThat(o.terminalOutcome()).isEqualTo("stabilized");
                                assertThat(o.gateOutcome()).isEqualTo("qualified");
                            });
        }

        @Test
        void shouldStoreQaFeedbackAndClearItOnPass() throws Exception {
            qaOutcomes(NodeResult.FAILED, NodeResult.SUCCESS);
            String id = startDiscovery();

            executor.executeStep(id);
            ExecutionState afterFailure = executor.executeStep(id);

            assertThat(afterFailure.getContextState().qaFeedback()).containsKey("issues");
            assertThat(afterFailure.getContextState().document("project_discovery")).isPresent();

            executor.executeStep(id);
            ExecutionState afterPass = executor.executeStep(id);

            assertThat(afterPass.getContextState().containsKey(ContextState.QA_FEEDBACK)).isFalse();
        }

        @Test
        void shouldEscalateWhenCircuitBreakerTrips() throws Exception {
            qaOutcomes(NodeResult.FAILED);
            String id = startDiscovery();

            ExecutionState state = executor.runToCompletionOrPause(id);

            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(state.isEscalationActive()).isTrue();
            assertThat(state.getEscalationOptions()).containsExactly("retry", "narrow_scope", "abandon");
            assertThat(state.getRetryCounts()).containsEntry("generate", 2);
            assertThat(state.getCurrentNodeId()).isEqualTo("qa");
            verify(listener).onEscalation(any(), eq(List.of("retry", "narrow_scope", "abandon")));
        }

        @Test
        void shouldIgnoreStepsWhileEscalationIsActive() throws Exception {
            qaOutcomes(NodeResult.FAILED);
            String id = startDiscovery();
            ExecutionState escalated = executor.runToCompletionOrPause(id);
            int historySize = escalated.getNodeHistory().size();

            ExecutionState stepped = executor.executeStep(id);

            assertThat(stepped.getNodeHistory()).hasSize(historySize);
            assertThat(stepped.isEscalationActive()).isTrue();
            assertThatThrownBy(() -> executor.submitUserInput(id, "more detail", null))
                    .isInstanceOfSatisfying(
                            NotPausedException.class,
                            e -> assertThat(e.getStatus()).isEqualTo("escalation"));
        }
    }

    // ---- escalation decisions ----------------------------------------------

    @Nested
    class Escalation {

        private String escalatedId;

        @BeforeEach
        void escalate() throws Exception {
            qaOutcomes(NodeResult.FAILED);
            escalatedId = startDiscovery();
            executor.runToCompletionOrPause(escalatedId);
        }

        @Test
        void shouldCompleteAsAbandoned() throws Exception {
            ExecutionState state = executor.handleEscalationChoice(escalatedId, "abandon");

            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(state.getTerminalOutcome()).isEqualTo(PlanExecutor.ABANDONED_OUTCOME);
            assertThat(state.getGateOutcome()).isEqualTo(PlanExecutor.ABANDON_GATE_OUTCOME);
            assertThat(state.isEscalationActive()).isFalse();
            assertThat(state.getNodeHistory().get(state.getNodeHistory().size() - 1).metadata())
                    .containsEntry("escalation_choice", "abandon");
            assertThat(recorder.getOutcomes())
                    .singleElement()
                    .satisfies(o -> assertThat(o.mappingConsistent()).isFalse());
        }

        @Test
        void shouldRejectChoiceThatWasNotOffered() throws Exception {
            assertThatThrownBy(() -> executor.handleEscalationChoice(escalatedId, "ignore"))
                    .isInstanceOfSatisfying(
                            InvalidEscalationChoiceException.class,
                            e -> {
                                assertThat(e.getChoice()).isEqualTo("ignore");
                                assertThat(e.getOptions()).contains("abandon");
                            });

            ExecutionState unchanged = repository.findByExecutionId(escalatedId).orElseThrow();
            assertThat(unchanged.isEscalationActive()).isTrue();
            assertThat(unchanged.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
        }

        @Test
        void shouldResetGeneratingCounterOnRetry() throws Exception {
            ExecutionState state = executor.handleEscalationChoice(escalatedId, "retry");

            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.RUNNING);
            assertThat(state.isEscalationActive()).isFalse();
            assertThat(state.getRetryCount("generate")).isZero();
            assertThat(state.getNodeHistory().get(state.getNodeHistory().size() - 1).outcome())
                    .isEqualTo(PlanExecutor.ESCALATION_RESOLVED);
        }

        @Test
        void shouldResumeRoutingAfterOtherChoice() throws Exception {
            qaOutcomes(NodeResult.SUCCESS);

            executor.handleEscalationChoice(escalatedId, "narrow_scope");
            ExecutionState state = executor.runToCompletionOrPause(escalatedId);

            assertThat(state.getCurrentNodeId()).isEqualTo("review_gate");
            assertThat(state.getRetryCount("generate")).isEqualTo(2);
        }

        @Test
        void shouldRejectMissingChoiceWithoutChangingState() throws Exception {
            assertThatThrownBy(() -> executor.handleEscalationChoice(escalatedId, null))
                    .isInstanceOfSatisfying(
                            InvalidEscalationChoiceException.class,
                            e -> assertThat(e.getChoice()).isNull());

            ExecutionState unchanged = repository.findByExecutionId(escalatedId).orElseThrow();
            assertThat(unchanged.isEscalationActive()).isTrue();
            assertThat(unchanged.getEscalationOptions()).contains("retry", "abandon");
        }

        @Test
        void shouldRejectChoiceWithoutActiveEscalation() throws Exception {
            executor.handleEscalationChoice(escalatedId, "abandon");

            assertThatThrownBy(() -> executor.handleEscalationChoice(escalatedId, "abandon"))
                    .isInstanceOf(NoActiveEscalationException.class);
        }
    }

    // ---- consent gate ------------------------------------------------------

    @Nested
    class ConsentGate {

        private String start() throws Exception {
            return executor.startExecution(SUBJECT, "consent_document", null).getExecutionId();
        }

        @Test
        void shouldStayAtGateUntilConsentIsGiven() throws Exception {
            String id = start();

            ExecutionState paused = executor.runToCompletionOrPause(id);
            ExecutionState again = executor.executeStep(id);

            assertThat(paused.getCurrentNodeId()).isEqualTo("consent");
            assertThat(paused.getPendingChoices()).containsExactly("proceed", "not_ready");
            assertThat(again.getCurrentNodeId()).isEqualTo("consent");
            assertThat(again.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
        }

        @Test
        void shouldGenerateAfterProceed() throws Exception {
            String id = start();
            executor.runToCompletionOrPause(id);

            ExecutionState resumed = executor.submitUserInput(id, null, "proceed");
            ExecutionState done = executor.runToCompletionOrPause(id);

            assertThat(resumed.getCurrentNodeId()).isEqualTo("generate");
            assertThat(resumed.isPendingUserInput()).isFalse();
            assertThat(done.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(done.getTerminalOutcome()).isEqualTo("stabilized");
            assertThat(done.getContextState().document("consent_document")).isPresent();
        }

        @Test
        void shouldEndBlockedWhenDeclined() throws Exception {
            String id = start();
            executor.runToCompletionOrPause(id);

            ExecutionState done = executor.submitUserInput(id, null, "not_ready");

            assertThat(done.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(done.getTerminalOutcome()).isEqualTo("blocked");
            assertThat(done.getCurrentNodeId()).isEqualTo("end_declined");
        }

        @Test
        void shouldRepromptOnInvalidConsentAnswer() throws Exception {
            String id = start();
            executor.runToCompletionOrPause(id);

            ExecutionState state = executor.submitUserInput(id, null, "perhaps");

            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(state.getCurrentNodeId()).isEqualTo("consent");
            assertThat(state.getPendingChoices()).containsExactly("proceed", "not_ready");
        }

        @Test
        void shouldRejectResumeWithoutInputOrChoice() throws Exception {
            String id = start();
            ExecutionState paused = executor.runToCompletionOrPause(id);
            int historySize = paused.getNodeHistory().size();

            assertThatThrownBy(() -> executor.submitUserInput(id, "  ", null))
                    .isInstanceOfSatisfying(
                            MissingUserInputException.class,
                            e -> assertThat(e.getExecutionId()).isEqualTo(id));

            ExecutionState unchanged = repository.findByExecutionId(id).orElseThrow();
            assertThat(unchanged.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
            assertThat(unchanged.isPendingUserInput()).isTrue();
            assertThat(unchanged.getNodeHistory()).hasSize(historySize);
        }

        @Test
        void shouldRejectInputWhenNotPaused() throws Exception {
            String id = start();

            assertThatThrownBy(() -> executor.submitUserInput(id, null, "proceed"))
                    .isInstanceOfSatisfying(
                            NotPausedException.class,
                            e -> assertThat(e.getStatus()).isEqualTo("pending"));
        }
    }

    // ---- failures ----------------------------------------------------------

    @Nested
    class Failures {

        @Test
        void shouldPersistFailureBeforeRethrowingNodeError() throws Exception {
            executors.register(
                    ScriptedNodeExecutor.throwing(NodeType.TASK, new IllegalStateException("model offline")));
            String id = startDiscovery();

            assertThatThrownBy(() -> executor.executeStep(id))
                    .isInstanceOfSatisfying(
                            NodeExecutionException.class,
                            e -> {
                                assertThat(e.getNodeId()).isEqualTo("generate");
                                assertThat(e.getCause()).hasMessage("model offline");
                            });

            ExecutionStatusView view = executor.getExecutionStatus(id);
            assertThat(view.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(view.failureReason()).isEqualTo("model offline");
            verify(listener).onFailed(any(), eq("model offline"));
        }

        @Test
        void shouldFailWhenNoExecutorIsRegistered() throws Exception {
            PlanExecutor bare =
                    new PlanExecutor(planRegistry, repository, new DefaultNodeExecutorRegistry());
            String id =
                    bare.startExecution(SUBJECT, TestPlans.DISCOVERY_WORKFLOW, null).getExecutionId();

            assertThatThrownBy(() -> bare.executeStep(id)).isInstanceOf(NodeExecutionException.class);
            assertThat(bare.getExecutionStatus(id).status()).isEqualTo(ExecutionStatus.FAILED);
        }

        @Test
        void shouldFailWithoutThrowingWhenNoEdgeMatches() throws Exception {
            executors.register(ScriptedNodeExecutor.of(NodeType.TASK, NodeResult.BLOCKED));
            String id = startDiscovery();

            ExecutionState state = executor.runToCompletionOrPause(id);

            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(state.lastFailureReason())
                    .contains("No routing edge for outcome 'blocked' from node generate");
            assertThat(state.getCurrentNodeId()).isEqualTo("generate");
        }

        @Test
        void shouldReturnTerminalExecutionUnchanged() throws Exception {
            executors.register(ScriptedNodeExecutor.of(NodeType.TASK, NodeResult.BLOCKED));
            String id = startDiscovery();
            ExecutionState failed = executor.runToCompletionOrPause(id);

            ExecutionState again = executor.executeStep(id);

            assertThat(again.getNodeHistory()).hasSameSizeAs(failed.getNodeHistory());
            assertThat(again.getUpdatedAt()).isEqualTo(failed.getUpdatedAt());
        }

        @Test
        void shouldStopAtStepBudget() throws Exception {
            Map<String, Object> loop =
                    map(
                            "workflow_id", "ping_pong",
                            "entry_node_ids", list("ping"),
                            "nodes",
                                    list(
                                            map("node_id", "ping", "type", "task", "task_ref", "p"),
                                            map("node_id", "pong", "type", "task", "task_ref", "q")),
                            "edges",
                                    list(
                                            edge("e_ping", "ping", "success", "pong"),
                                            edge("e_pong", "pong", "success", "ping")));
            planRegistry.register(TestPlans.load(loop));
            String id = executor.startExecution(SUBJECT, "ping_pong", null).getExecutionId();

            assertThatThrownBy(() -> executor.runToCompletionOrPause(id, 5))
                    .isInstanceOfSatisfying(
                            MaxStepsExceededException.class,
                            e -> assertThat(e.getMaxSteps()).isEqualTo(5));
            assertThat(executor.getExecutionStatus(id).stepCount()).isEqualTo(5);
        }

        @Test
        void shouldRejectUnknownExecution() {
            assertThatThrownBy(() -> executor.executeStep("exec-missing"))
                    .isInstanceOf(ExecutionNotFoundException.class);
        }

        @Test
        void shouldCompleteEvenWhenRecorderFails() throws Exception {
            OutcomeRecorder broken =
                    (state, plan, outcome) -> {
                        throw new IllegalStateException("audit store down");
                    };
            PlanExecutor withBrokenRecorder =
                    new PlanExecutor(planRegistry, repository, executors, broken, null, 100);
            String id =
                    withBrokenRecorder
                            .startExecution(SUBJECT, "consent_document", null)
                            .getExecutionId();
            withBrokenRecorder.runToCompletionOrPause(id);

            ExecutionState done = withBrokenRecorder.submitUserInput(id, null, "not_ready");

            assertThat(done.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        }

        @Test
        void shouldPersistCompletionBeforeNotifyingListener() throws Exception {
            String id = executor.startExecution(SUBJECT, "consent_document", null).getExecutionId();
            executor.runToCompletionOrPause(id);
            doThrow(new IllegalStateException("listener broke")).when(listener).onCompleted(any());

            assertThatThrownBy(() -> executor.submitUserInput(id, null, "not_ready"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("listener broke");

            ExecutionState stored = repository.findByExecutionId(id).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(stored.getTerminalOutcome()).isEqualTo("blocked");
            assertThat(recorder.getOutcomes()).hasSize(1);
            assertThatThrownBy(() -> executor.submitUserInput(id, null, "not_ready"))
                    .isInstanceOf(NotPausedException.class);
            assertThat(recorder.getOutcomes()).hasSize(1);
        }

        @Test
        void shouldPersistEscalationBeforeNotifyingListener() throws Exception {
            qaOutcomes(NodeResult.FAILED);
            String id = startDiscovery();
            doThrow(new IllegalStateException("listener broke"))
                    .when(listener)
                    .onEscalation(any(), any());

            assertThatThrownBy(() -> executor.runToCompletionOrPause(id))
                    .isInstanceOf(IllegalStateException.class);

            ExecutionState stored = repository.findByExecutionId(id).orElseThrow();
            assertThat(stored.isEscalationActive()).isTrue();
            assertThat(stored.getStatus()).isEqualTo(ExecutionStatus.PAUSED);
        }

        @Test
        void shouldPropagateListenerFailure() throws Exception {
            String id = startDiscovery();
            doThrow(new IllegalStateException("listener broke")).when(listener).onCheckpoint(any());

            assertThatThrownBy(() -> executor.executeStep(id))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("listener broke");
        }
    }

    // ---- listener and queries ----------------------------------------------

    @Test
    void shouldNotifyListenerInStepOrder() throws Exception {
        String id = startDiscovery();

        executor.executeStep(id);

        InOrder order = inOrder(listener);
        order.verify(listener).onNodeStart(any(), any(Node.class));
        order.verify(listener).onNodeComplete(any(), any(Node.class), any(NodeResult.class));
        order.verify(listener).onCheckpoint(any());
    }

    @Test
    void shouldExposePauseDetailsInStatusView() throws Exception {
        qaOutcomes(NodeResult.SUCCESS);
        String id = startDiscovery();
        executor.runToCompletionOrPause(id);

        ExecutionStatusView view = executor.getExecutionStatus(id);

        assertThat(view.status()).isEqualTo(ExecutionStatus.PAUSED);
        assertThat(view.pendingUserInput()).isTrue();
        assertThat(view.pendingChoices()).containsExactly("qualified", "not_ready");
        assertThat(view.failureReason()).isNull();
        assertThat(view.stepCount()).isEqualTo(3);
    }

    @Test
    void shouldListExecutionsByStatus() throws Exception {
        qaOutcomes(NodeResult.SUCCESS);
        String paused = startDiscovery();
        executor.runToCompletionOrPause(paused);
        executor.startExecution("proj-2", TestPlans.DISCOVERY_WORKFLOW, null);

        assertThat(executor.listExecutions(ExecutionStatus.PAUSED, 10))
                .extracting(ExecutionStatusView::executionId)
                .containsExactly(paused);
        assertThat(executor.listExecutions(null, 10)).hasSize(2);
        verify(listener, atLeastOnce()).onPaused(any());
    }

    @Test
    void shouldGenerateDistinctExecutionIds() {
        assertThat(PlanExecutor.newExecutionId()).isNotEqualTo(PlanExecutor.newExecutionId());
    }

    @Test
    void shouldRejectNonPositiveStepBudget() {
        assertThatThrownBy(
                        () -> new PlanExecutor(planRegistry, repository, executors, null, null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
