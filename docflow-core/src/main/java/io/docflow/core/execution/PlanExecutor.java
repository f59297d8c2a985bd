package io.docflow.core.execution;

import io.docflow.core.exception.DocflowException;
import io.docflow.core.exception.ExecutionNotFoundException;
import io.docflow.core.exception.InvalidEscalationChoiceException;
import io.docflow.core.exception.MaxStepsExceededException;
import io.docflow.core.exception.MissingUserInputException;
import io.docflow.core.exception.NoActiveEscalationException;
import io.docflow.core.exception.NodeExecutionException;
import io.docflow.core.exception.NotPausedException;
import io.docflow.core.exception.PlanNotFoundException;
import io.docflow.core.execution.executor.NodeContext;
import io.docflow.core.execution.executor.NodeExecutor;
import io.docflow.core.execution.executor.NodeExecutorRegistry;
import io.docflow.core.execution.executor.NodeResult;
import io.docflow.core.plan.PlanRegistry;
import io.docflow.core.plan.WorkflowPlan;
import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.routing.EdgeRouter;
import io.docflow.core.routing.OutcomeMapper;
import io.docflow.core.routing.RoutingDecision;
import io.docflow.core.state.ContextState;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.state.ExecutionState;
import io.docflow.core.state.ExecutionStateRepository;
import io.docflow.core.state.ExecutionStatus;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// State machine that drives executions of workflow plans.
///
/// The plan executor is the only writer of {@link ExecutionState}. Each step loads
/// the state, runs the current node through its {@link NodeExecutor}, interprets the
/// {@link NodeResult} with the {@link EdgeRouter}, and persists the state. Node
/// executors report outcomes; this class alone decides what happens next.
///
/// ### Step handling
/// 1. Record the result in history
/// 2. If the result asks for input, pause and stop
/// 3. Store produced documents and QA feedback in the context
/// 4. Route the outcome:
///    - non-advancing edge with escalation options: activate escalation (paused)
///    - no matching edge: fail the execution
///    - terminal target: resolve both outcome vocabularies and complete
///    - otherwise advance; a QA `failed` outcome increments the retry counter of the
///      generating node before the next step runs
/// 5. Persist, then notify the listener and record terminal outcomes
///
/// ### Contracts
/// - State is persisted after every node completion, including when the node throws
///   (the execution is failed, persisted, then the error is rethrown)
/// - Listener callbacks and outcome recording run only after the state they report is
///   persisted; a throwing listener never leaves an unsaved transition behind
/// - Terminal executions are never mutated; stepping one returns it unchanged
/// - Caller misuse (input to a non-paused execution, invalid escalation choices)
///   fails before any mutation
///
/// @implNote Stateless apart from its collaborators; safe to share across threads
/// as long as no two threads step the same execution concurrently.
///
/// @see EdgeRouter for edge selection
/// @see ExecutionStateRepository for persistence
public class PlanExecutor {

    private static final Logger logger = Logger.getLogger(PlanExecutor.class.getName());

    public static final String ESCALATION_RESOLVED = "escalation_resolved";
    public static final String ABANDON = "abandon";
    public static final String RETRY = "retry";
    public static final String ABANDONED_OUTCOME = "abandoned";
    public static final String ABANDON_GATE_OUTCOME = "escalation_abandon";
    public static final int DEFAULT_LIST_LIMIT = 50;

    private static final Runnable NO_NOTIFICATION = () -> {};

    private final PlanRegistry planRegistry;
    private final ExecutionStateRepository repository;
    private final NodeExecutorRegistry executorRegistry;
    private final OutcomeRecorder outcomeRecorder;
    private final ExecutionListener listener;
    private final int defaultMaxSteps;

    public PlanExecutor(
            PlanRegistry planRegistry,
            ExecutionStateRepository repository,
            NodeExecutorRegistry executorRegistry) {
        this(planRegistry, repository, executorRegistry, OutcomeRecorder.NOOP, ExecutionListener.NOOP, 100);
    }

    /// Creates an executor.
    ///
    /// @param planRegistry plans by workflow id and document type, not null
    /// @param repository state persistence, not null
    /// @param executorRegistry node executors by type, not null
    /// @param outcomeRecorder audit recorder, null for none
    /// @param listener lifecycle listener, null for none
    /// @param defaultMaxSteps step budget when none is given, positive
    public PlanExecutor(
            PlanRegistry planRegistry,
            ExecutionStateRepository repository,
            NodeExecutorRegistry executorRegistry,
            OutcomeRecorder outcomeRecorder,
            ExecutionListener listener,
            int defaultMaxSteps) {
        this.planRegistry = Objects.requireNonNull(planRegistry, "planRegistry must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.executorRegistry =
                Objects.requireNonNull(executorRegistry, "executorRegistry must not be null");
        this.outcomeRecorder = outcomeRecorder != null ? outcomeRecorder : OutcomeRecorder.NOOP;
        this.listener = listener != null ? listener : ExecutionListener.NOOP;
        if (defaultMaxSteps < 1) {
            throw new IllegalArgumentException("defaultMaxSteps must be positive: " + defaultMaxSteps);
        }
        this.defaultMaxSteps = defaultMaxSteps;
    }

    // -- public operations ----------------------------------------------------

    /// Starts an execution of the plan registered for a document type.
    ///
    /// If a non-terminal execution of the same plan already exists for the subject, that
    /// execution is returned instead of creating a duplicate.
    ///
    /// @param subjectId project or document the execution works on, not null
    /// @param documentType document type whose plan to run, not null
    /// @param initialContext initial governed context values, may be null
    /// @return the new or existing execution, never null
    /// @throws PlanNotFoundException if no plan is registered for the document type
    /// @throws IllegalArgumentException if the initial context uses ungoverned keys
    public ExecutionState startExecution(
            String subjectId, String documentType, Map<String, Object> initialContext)
            throws PlanNotFoundException {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        WorkflowPlan plan =
                planRegistry
                        .getByDocumentType(documentType)
                        .orElseThrow(() -> new PlanNotFoundException(documentType));

        Optional<ExecutionState> existing =
                repository.findActiveBySubject(subjectId, plan.getWorkflowId());
        if (existing.isPresent()) {
            logger.info(
                    "Reusing active execution "
                            + existing.get().getExecutionId()
                            + " for subject "
                            + subjectId);
            return existing.get();
        }

        ExecutionState state =
                ExecutionState.builder()
                        .executionId(newExecutionId())
                        .workflowId(plan.getWorkflowId())
                        .subjectId(subjectId)
                        .documentType(plan.getDocumentType())
                        .currentNodeId(plan.getPrimaryEntryNodeId())
                        .status(ExecutionStatus.PENDING)
                        .contextState(ContextState.of(initialContext))
                        .build();
        repository.save(state);
        logger.info(
                "Started execution "
                        + state.getExecutionId()
                        + " of "
                        + plan
                        + " for subject "
                        + subjectId);
        listener.onExecutionStarted(ExecutionSnapshot.from(state));
        return state;
    }

    /// Executes the current node of an execution without user input.
    ///
    /// @see #executeStep(String, String, String)
    public ExecutionState executeStep(String executionId) throws DocflowException {
        return executeStep(executionId, null, null);
    }

    /// Executes the current node of an execution and routes its outcome.
    ///
    /// Terminal executions are returned unchanged. Executions waiting on an escalation
    /// decision are returned unchanged until {@link #handleEscalationChoice} resolves it.
    ///
    /// @param executionId execution to advance, not null
    /// @param userInput free-text input resuming a pause, may be null
    /// @param userChoice choice resuming a pause, may be null
    /// @return the persisted state after the step, never null
    /// @throws ExecutionNotFoundException if the execution does not exist
    /// @throws PlanNotFoundException if the execution's plan is no longer registered
    /// @throws NodeExecutionException if the node threw; the execution is persisted as failed
    public ExecutionState executeStep(String executionId, String userInput, String userChoice)
            throws DocflowException {
        ExecutionState state = load(executionId);
        if (state.isTerminal()) {
            logger.fine(() -> "Execution " + executionId + " already " + state.getStatus().wireValue());
            return state;
        }
        if (state.isEscalationActive()) {
            logger.fine(() -> "Execution " + executionId + " awaits an escalation decision");
            return state;
        }

        WorkflowPlan plan = planRegistry.get(state.getWorkflowId());
        Optional<Node> maybeNode = plan.getNode(state.getCurrentNodeId());
        if (maybeNode.isEmpty()) {
            return failAndThrow(
                    state,
                    state.getCurrentNodeId(),
                    new IllegalStateException(
                            "Node " + state.getCurrentNodeId() + " not found in " + plan));
        }
        Node node = maybeNode.get();

        boolean hasInput = isPresent(userInput) || isPresent(userChoice);
        boolean resumingStructuredInput =
                hasInput && state.isPendingUserInput() && state.getPendingPayload() != null;
        if (state.isPendingUserInput() && hasInput) {
            state.clearPause();
            mergeAnswer(state, node, userInput, userChoice);
        }
        state.markRunning();

        NodeResult result;
        if (resumingStructuredInput && node.getType() == NodeType.PGC) {
            logger.info("Node " + node.getNodeId() + " received answers to its question set");
            result = NodeResult.builder(NodeResult.SUCCESS).metadata("answers_received", true).build();
        } else {
            NodeContext context = buildContext(state, userInput, userChoice);
            try {
                result = runNode(node, context, state);
            } catch (Exception e) {
                return failAndThrow(state, node.getNodeId(), e);
            }
        }

        Runnable notification = handleResult(result, node, state, plan);
        ExecutionState saved = persist(state);
        notification.run();
        return saved;
    }

    /// Steps an execution until it completes, fails or pauses.
    ///
    /// @throws MaxStepsExceededException if `maxSteps` steps did not reach a stop
    public ExecutionState runToCompletionOrPause(String executionId, int maxSteps)
            throws DocflowException {
        for (int step = 0; step < maxSteps; step++) {
            ExecutionState state = load(executionId);
            if (state.isTerminal() || state.getStatus() == ExecutionStatus.PAUSED) {
                logger.info(
                        "Execution "
                                + executionId
                                + " stopped at "
                                + state.getCurrentNodeId()
                                + " ("
                                + state.getStatus().wireValue()
                                + ")");
                return state;
            }
            executeStep(executionId);
        }
        ExecutionState state = load(executionId);
        if (state.isTerminal() || state.getStatus() == ExecutionStatus.PAUSED) {
            return state;
        }
        throw new MaxStepsExceededException(executionId, maxSteps);
    }

    /// Steps an execution with the configured default step budget.
    public ExecutionState runToCompletionOrPause(String executionId) throws DocflowException {
        return runToCompletionOrPause(executionId, defaultMaxSteps);
    }

    /// Resumes a paused execution with input.
    ///
    /// @throws NotPausedException if the execution is not paused for input
    /// @throws MissingUserInputException if both input and choice are null or blank
    public ExecutionState submitUserInput(String executionId, String userInput, String userChoice)
            throws DocflowException {
        ExecutionState state = load(executionId);
        if (state.getStatus() != ExecutionStatus.PAUSED || state.isEscalationActive()) {
            throw new NotPausedException(executionId, describeStatus(state));
        }
        if (!isPresent(userInput) && !isPresent(userChoice)) {
            throw new MissingUserInputException(executionId);
        }
        return executeStep(executionId, userInput, userChoice);
    }

    /// Resolves an active escalation.
    ///
    /// - `abandon` completes the execution with terminal outcome `abandoned`
    /// - `retry` resets the generating node's retry counter and resumes
    /// - any other offered choice resumes normal routing
    ///
    /// @throws NoActiveEscalationException if no escalation is active
    /// @throws InvalidEscalationChoiceException if the choice was not offered
    public ExecutionState handleEscalationChoice(String executionId, String choice)
            throws DocflowException {
        ExecutionState state = load(executionId);
        if (!state.isEscalationActive()) {
            throw new NoActiveEscalationException(executionId);
        }
        if (choice == null || !state.getEscalationOptions().contains(choice)) {
            throw new InvalidEscalationChoiceException(choice, state.getEscalationOptions());
        }

        state.clearEscalation();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("escalation_choice", choice);
        state.recordExecution(state.getCurrentNodeId(), ESCALATION_RESOLVED, metadata);
        logger.info("Execution " + executionId + " escalation resolved with '" + choice + "'");

        if (ABANDON.equals(choice)) {
            state.setCompleted(ABANDONED_OUTCOME, ABANDON_GATE_OUTCOME);
            ExecutionState saved = persist(state);
            recordOutcome(saved, planRegistry.get(saved.getWorkflowId()));
            listener.onCompleted(ExecutionSnapshot.from(saved));
            return saved;
        }
        if (RETRY.equals(choice)) {
            String counterNode =
                    state.getGeneratingNodeId() != null
                            ? state.getGeneratingNodeId()
                            : state.getCurrentNodeId();
            state.resetRetry(counterNode);
        }
        state.markRunning();
        return persist(state);
    }

    /// Returns the status view of an execution.
    ///
    /// @throws ExecutionNotFoundException if the execution does not exist
    public ExecutionStatusView getExecutionStatus(String executionId)
            throws ExecutionNotFoundException {
        return ExecutionStatusView.of(load(executionId));
    }

    /// Lists executions, most recently created first.
    ///
    /// @param statusFilter status to filter on, null for all
    /// @param limit maximum number of results, positive
    /// @return status views, never null
    public List<ExecutionStatusView> listExecutions(ExecutionStatus statusFilter, int limit) {
        return repository.list(statusFilter, limit).stream()
                .map(ExecutionStatusView::of)
                .collect(Collectors.toList());
    }

    // -- step internals -------------------------------------------------------

    private NodeResult runNode(Node node, NodeContext context, ExecutionState state)
            throws Exception {
        NodeExecutor executor = executorRegistry.getExecutorOrThrow(node.getType());
        ExecutionSnapshot snapshot = ExecutionSnapshot.from(state);
        listener.onNodeStart(snapshot, node);
        logger.fine(() -> "Executing node " + node.getNodeId() + " (" + node.getType().wireValue() + ")");
        NodeResult result = executor.execute(node, context, snapshot);
        if (result == null) {
            throw new IllegalStateException("Executor for " + node.getNodeId() + " returned no result");
        }
        logger.fine(() -> "Node " + node.getNodeId() + " returned outcome " + result.getOutcome());
        listener.onNodeComplete(snapshot, node, result);
        return result;
    }

    /// Applies a node result to the state.
    ///
    /// @return listener notification to fire once the state is persisted, never null
    private Runnable handleResult(
            NodeResult result, Node node, ExecutionState state, WorkflowPlan plan) {
        String nodeId = node.getNodeId();
        state.recordExecution(nodeId, result.getOutcome(), result.getMetadata());
        applyContextUpdates(result, node, state);

        if (result.isRequiresUserInput()) {
            state.setPaused(
                    result.getUserPrompt(),
                    result.getUserChoices(),
                    result.getPayload(),
                    result.getSchemaRef());
            logger.info("Execution " + state.getExecutionId() + " paused at " + nodeId);
            return () -> listener.onPaused(ExecutionSnapshot.from(state));
        }

        if (node.isEnd()) {
            return complete(state, plan, node, result);
        }

        EdgeRouter router = new EdgeRouter(plan);
        RoutingDecision decision =
                router.getNextNode(nodeId, result.getOutcome(), ExecutionSnapshot.from(state));

        if (decision.isNonAdvancing()) {
            List<String> options = decision.escalationOptions();
            if (!options.isEmpty()) {
                state.setEscalation(options);
                logger.info(
                        "Execution "
                                + state.getExecutionId()
                                + " escalated at "
                                + nodeId
                                + " via edge "
                                + decision.matchedEdge().edgeId()
                                + ", options "
                                + options);
                return () -> listener.onEscalation(ExecutionSnapshot.from(state), options);
            }
            logger.warning(
                    "Non-advancing edge "
                            + decision.matchedEdge().edgeId()
                            + " without escalation options at "
                            + nodeId);
            return NO_NOTIFICATION;
        }

        if (!decision.matched()) {
            String reason =
                    "No routing edge for outcome '" + result.getOutcome() + "' from node " + nodeId;
            logger.warning("Execution " + state.getExecutionId() + ": " + reason);
            state.setFailed(reason);
            return () -> listener.onFailed(ExecutionSnapshot.from(state), reason);
        }

        String nextNodeId = decision.nextNodeId();
        state.advanceTo(nextNodeId);
        if (router.isTerminalNode(nextNodeId)) {
            return complete(state, plan, plan.getNode(nextNodeId).orElseThrow(), result);
        }

        logger.info(
                "Execution " + state.getExecutionId() + " advanced " + nodeId + " -> " + nextNodeId);
        if (node.getType() == NodeType.QA && NodeResult.FAILED.equals(result.getOutcome())) {
            GeneratingNodeResolver.findGeneratingNode(state.getNodeHistory(), plan)
                    .ifPresent(
                            generating -> {
                                int count = state.incrementRetry(generating);
                                logger.info(
                                        "QA failed, retry count of " + generating + " is now " + count);
                            });
        }
        return NO_NOTIFICATION;
    }

    /// Copies facts reported by the result into the governed context.
    private void applyContextUpdates(NodeResult result, Node node, ExecutionState state) {
        Map<String, Object> delta = new HashMap<>();
        if (result.getProducedDocument() != null && node.getProduces() != null) {
            delta.put(ContextState.documentKey(node.getProduces()), result.getProducedDocument());
        }
        switch (node.getType()) {
            case TASK -> state.setGeneratingNodeId(node.getNodeId());
            case PGC -> {
                if (result.getProducedDocument() != null) {
                    delta.put(ContextState.PGC_QUESTIONS, result.getProducedDocument());
                }
            }
            case QA -> {
                if (NodeResult.FAILED.equals(result.getOutcome())) {
                    delta.put(ContextState.QA_FEEDBACK, result.getMetadata().get("feedback"));
                } else if (NodeResult.SUCCESS.equals(result.getOutcome())
                        && state.getContextState().containsKey(ContextState.QA_FEEDBACK)) {
                    delta.put(ContextState.QA_FEEDBACK, null);
                }
            }
            case INTAKE_GATE -> {
                Object summary = result.getMetadata().get("intake_summary");
                if (summary != null) {
                    delta.put(ContextState.INTAKE_SUMMARY, summary);
                }
            }
            default -> {}
        }
        if (!delta.isEmpty()) {
            state.updateContextState(delta);
        }
    }

    /// Merges an answer to a pause into the context so the node is re-entered with it
    /// instead of asking again.
    private void mergeAnswer(ExecutionState state, Node node, String userInput, String userChoice) {
        Map<String, Object> delta = new HashMap<>();
        switch (node.getType()) {
            case GATE -> {
                if (isPresent(userChoice)) {
                    delta.put(
                            ContextState.GATE_ANSWERS,
                            state.getContextState().gateAnswersWith(node.getNodeId(), userChoice));
                }
            }
            case PGC ->
                    delta.put(
                            ContextState.PGC_ANSWERS, isPresent(userInput) ? userInput : userChoice);
            case INTAKE_GATE -> {
                if (isPresent(userInput) && state.getContextState().userInput().isEmpty()) {
                    delta.put(ContextState.USER_INPUT, userInput);
                }
            }
            default -> {}
        }
        if (!delta.isEmpty()) {
            state.updateContextState(delta);
        }
    }

    private NodeContext buildContext(ExecutionState state, String userInput, String userChoice) {
        return NodeContext.builder()
                .executionId(state.getExecutionId())
                .workflowId(state.getWorkflowId())
                .subjectId(state.getSubjectId())
                .documentType(state.getDocumentType())
                .userInput(userInput)
                .userChoice(userChoice)
                .contextState(state.getContextState())
                .extra("retry_count", state.getRetryCount(state.getCurrentNodeId()))
                .build();
    }

    /// Completes an execution at an end node.
    ///
    /// The terminal outcome is the end node's `terminal_outcome`, falling back to the
    /// plan mapping of the gate outcome. The gate outcome is the one the routed
    /// result reported, falling back to the end node's declared `gate_outcome`.
    ///
    /// @return outcome recording and completion notification, run after the state is persisted
    private Runnable complete(
            ExecutionState state, WorkflowPlan plan, Node endNode, NodeResult result) {
        Object reported = result.getMetadata().get("gate_outcome");
        String gateOutcome = reported != null ? reported.toString() : endNode.getGateOutcome();
        String terminalOutcome = endNode.getTerminalOutcome();
        if (terminalOutcome == null) {
            terminalOutcome = OutcomeMapper.fromPlan(plan).mapOptional(gateOutcome).orElse(null);
        }
        state.setCompleted(terminalOutcome, gateOutcome);
        logger.info(
                "Execution "
                        + state.getExecutionId()
                        + " reached "
                        + endNode.getNodeId()
                        + ": "
                        + terminalOutcome
                        + " (gate: "
                        + gateOutcome
                        + ")");
        return () -> {
            recordOutcome(state, plan);
            listener.onCompleted(ExecutionSnapshot.from(state));
        };
    }

    /// Best effort: recorder failures are logged, never propagated.
    private void recordOutcome(ExecutionState state, WorkflowPlan plan) {
        OutcomeMapper mapper = OutcomeMapper.fromPlan(plan);
        boolean consistent =
                mapper.mapOptional(state.getGateOutcome())
                        .map(expected -> expected.equals(state.getTerminalOutcome()))
                        .orElse(false);
        if (!consistent && state.getGateOutcome() != null && mapper.isMapped(state.getGateOutcome())) {
            logger.warning(
                    "Terminal outcome "
                            + state.getTerminalOutcome()
                            + " disagrees with mapping of gate outcome "
                            + state.getGateOutcome());
        }
        GovernanceOutcome outcome =
                new GovernanceOutcome(
                        state.getExecutionId(),
                        state.getWorkflowId(),
                        state.getSubjectId(),
                        state.getDocumentType(),
                        state.getGateOutcome(),
                        state.getTerminalOutcome(),
                        consistent,
                        state.getRetryCounts(),
                        Instant.now());
        try {
            outcomeRecorder.record(ExecutionSnapshot.from(state), plan, outcome);
        } catch (Exception e) {
            logger.log(
                    Level.WARNING,
                    "Failed to record governance outcome for " + state.getExecutionId(),
                    e);
        }
    }

    private <T> T failAndThrow(ExecutionState state, String nodeId, Exception cause)
            throws NodeExecutionException {
        logger.log(
                Level.SEVERE,
                "Node " + nodeId + " failed in execution " + state.getExecutionId(),
                cause);
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        state.setFailed(reason);
        persist(state);
        listener.onFailed(ExecutionSnapshot.from(state), reason);
        throw new NodeExecutionException(state.getExecutionId(), nodeId, cause);
    }

    private ExecutionState persist(ExecutionState state) {
        repository.save(state);
        listener.onCheckpoint(ExecutionSnapshot.from(state));
        return state;
    }

    private ExecutionState load(String executionId) throws ExecutionNotFoundException {
        return repository
                .findByExecutionId(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    private static String describeStatus(ExecutionState state) {
        return state.isEscalationActive() ? "escalation" : state.getStatus().wireValue();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    static String newExecutionId() {
        return "exec-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
