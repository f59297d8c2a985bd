package io.docflow.core.state;

import io.docflow.core.util.RawMaps;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Mutable record of one run of a plan against one subject.
///
/// Owned and mutated exclusively by {@link io.docflow.core.execution.PlanExecutor};
/// node executors only ever see an {@link ExecutionSnapshot}. Every mutator bumps
/// `updatedAt`.
///
/// ### Invariants
/// - Status moves `pending -> running <-> paused -> completed | failed`; once terminal,
///   every mutator throws {@link IllegalStateException}
/// - Node history is append-only and ordered by execution
/// - Retry counters are keyed by the generating node, never by the QA node
/// - Pause fields are set and cleared together
/// - `gateOutcome` and `terminalOutcome` are only set at completion
///
/// @implNote **Not thread-safe**. One writer per execution at a time; the repository
/// save is the serialization point.
///
/// @see ExecutionSnapshot for the immutable, persisted form
public final class ExecutionState {

    public static final String FAILED_OUTCOME = "failed";
    public static final String FAILURE_REASON = "failure_reason";

    private final String executionId;
    private final String workflowId;
    private final String subjectId;
    private final String documentType;
    private final String userId;
    private final Instant createdAt;

    private String currentNodeId;
    private ExecutionStatus status;
    private final List<NodeExecution> nodeHistory;
    private final Map<String, Integer> retryCounts;
    private String generatingNodeId;
    private String gateOutcome;
    private String terminalOutcome;
    private String threadId;
    private ContextState contextState;
    private Instant updatedAt;

    private boolean pendingUserInput;
    private String pendingPrompt;
    private List<String> pendingChoices;
    private Map<String, Object> pendingPayload;
    private String pendingSchemaRef;

    private boolean escalationActive;
    private List<String> escalationOptions;

    private ExecutionState(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "executionId");
        this.workflowId = Objects.requireNonNull(builder.workflowId, "workflowId");
        this.subjectId = Objects.requireNonNull(builder.subjectId, "subjectId");
        this.documentType = builder.documentType;
        this.userId = builder.userId;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : createdAt;
        this.currentNodeId = builder.currentNodeId;
        this.status = builder.status != null ? builder.status : ExecutionStatus.PENDING;
        this.nodeHistory = new ArrayList<>(builder.nodeHistory);
        this.retryCounts = new HashMap<>(builder.retryCounts);
        this.generatingNodeId = builder.generatingNodeId;
        this.gateOutcome = builder.gateOutcome;
        this.terminalOutcome = builder.terminalOutcome;
        this.threadId = builder.threadId;
        this.contextState = builder.contextState != null ? builder.contextState : ContextState.EMPTY;
        this.pendingUserInput = builder.pendingUserInput;
        this.pendingPrompt = builder.pendingPrompt;
        this.pendingChoices = builder.pendingChoices;
        this.pendingPayload =
                builder.pendingPayload != null ? RawMaps.freezeMap(builder.pendingPayload) : null;
        this.pendingSchemaRef = builder.pendingSchemaRef;
        this.escalationActive = builder.escalationActive;
        this.escalationOptions =
                builder.escalationOptions != null ? List.copyOf(builder.escalationOptions) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    // -- mutators -------------------------------------------------------------

    /// Appends a history entry.
    ///
    /// @param nodeId executed node, not null
    /// @param outcome reported outcome, not null
    /// @param metadata executor metadata, may be null
    public void recordExecution(String nodeId, String outcome, Map<String, Object> metadata) {
        ensureNotTerminal();
        nodeHistory.add(new NodeExecution(nodeId, outcome, Instant.now(), metadata));
        touch();
    }

    /// Increments the retry counter of a generating node.
    ///
    /// @return the new count
    public int incrementRetry(String generatingNodeId) {
        ensureNotTerminal();
        int count = retryCounts.merge(generatingNodeId, 1, Integer::sum);
        touch();
        return count;
    }

    /// Returns the retry counter of a node, zero if it was never retried.
    public int getRetryCount(String nodeId) {
        return retryCounts.getOrDefault(nodeId, 0);
    }

    public void resetRetry(String nodeId) {
        ensureNotTerminal();
        retryCounts.remove(nodeId);
        touch();
    }

    /// Pauses for user input. All pause fields are set together.
    ///
    /// @param prompt human-readable prompt, may be null
    /// @param choices allowed answers, may be null for free input
    /// @param payload structured input request, may be null
    /// @param schemaRef schema of the structured answer, may be null
    public void setPaused(
            String prompt, List<String> choices, Map<String, Object> payload, String schemaRef) {
        ensureNotTerminal();
        this.status = ExecutionStatus.PAUSED;
        this.pendingUserInput = true;
        this.pendingPrompt = prompt;
        this.pendingChoices = choices != null ? List.copyOf(choices) : null;
        this.pendingPayload = payload != null ? RawMaps.freezeMap(payload) : null;
        this.pendingSchemaRef = schemaRef;
        touch();
    }

    /// Clears every pause field and resumes running.
    public void clearPause() {
        ensureNotTerminal();
        this.pendingUserInput = false;
        this.pendingPrompt = null;
        this.pendingChoices = null;
        this.pendingPayload = null;
        this.pendingSchemaRef = null;
        this.status = ExecutionStatus.RUNNING;
        touch();
    }

    /// Activates escalation after a circuit breaker trips; the execution pauses.
    ///
    /// @param options choices offered to the operator, not null
    public void setEscalation(List<String> options) {
        ensureNotTerminal();
        this.escalationActive = true;
        this.escalationOptions = List.copyOf(options);
        this.status = ExecutionStatus.PAUSED;
        touch();
    }

    public void clearEscalation() {
        ensureNotTerminal();
        this.escalationActive = false;
        this.escalationOptions = List.of();
        touch();
    }

    /// Shallow-merges a delta into the context.
    ///
    /// @see ContextState#merge(Map)
    public void updateContextState(Map<String, Object> delta) {
        ensureNotTerminal();
        this.contextState = contextState.merge(delta);
        touch();
    }

    public void markRunning() {
        ensureNotTerminal();
        this.status = ExecutionStatus.RUNNING;
        touch();
    }

    public void advanceTo(String nodeId) {
        ensureNotTerminal();
        this.currentNodeId = Objects.requireNonNull(nodeId, "nodeId");
        touch();
    }

    public void setGeneratingNodeId(String generatingNodeId) {
        ensureNotTerminal();
        this.generatingNodeId = generatingNodeId;
        touch();
    }

    public void setThreadId(String threadId) {
        ensureNotTerminal();
        this.threadId = threadId;
        touch();
    }

    /// Terminates the execution successfully, recording both outcome vocabularies.
    ///
    /// @param terminalOutcome execution vocabulary outcome, may be null
    /// @param gateOutcome governance vocabulary outcome, may be null
    public void setCompleted(String terminalOutcome, String gateOutcome) {
        ensureNotTerminal();
        this.status = ExecutionStatus.COMPLETED;
        this.terminalOutcome = terminalOutcome;
        this.gateOutcome = gateOutcome;
        touch();
    }

    /// Terminates the execution as failed and appends a `failed` history entry
    /// carrying the reason.
    ///
    /// @param reason failure description, not null
    public void setFailed(String reason) {
        ensureNotTerminal();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FAILURE_REASON, reason);
        nodeHistory.add(
                new NodeExecution(
                        currentNodeId != null ? currentNodeId : "", FAILED_OUTCOME, Instant.now(), metadata));
        this.status = ExecutionStatus.FAILED;
        touch();
    }

    private void ensureNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Execution " + executionId + " is " + status.wireValue() + " and cannot change");
        }
    }

    private void touch() {
        Instant now = Instant.now();
        updatedAt = now.isAfter(updatedAt) ? now : updatedAt;
    }

    // -- queries --------------------------------------------------------------

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /// Returns the reason recorded by the most recent {@link #setFailed(String)}.
    public Optional<String> lastFailureReason() {
        for (int i = nodeHistory.size() - 1; i >= 0; i--) {
            Object reason = nodeHistory.get(i).metadata().get(FAILURE_REASON);
            if (reason != null) {
                return Optional.of(reason.toString());
            }
        }
        return Optional.empty();
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getDocumentType() {
        return documentType;
    }

    public String getUserId() {
        return userId;
    }

    public String getCurrentNodeId() {
        return currentNodeId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    /// Returns the node history in execution order.
    ///
    /// @return unmodifiable view, never null
    public List<NodeExecution> getNodeHistory() {
        return Collections.unmodifiableList(nodeHistory);
    }

    /// Returns retry counters keyed by generating node id.
    ///
    /// @return unmodifiable view, never null
    public Map<String, Integer> getRetryCounts() {
        return Collections.unmodifiableMap(retryCounts);
    }

    public String getGeneratingNodeId() {
        return generatingNodeId;
    }

    public String getGateOutcome() {
        return gateOutcome;
    }

    public String getTerminalOutcome() {
        return terminalOutcome;
    }

    public String getThreadId() {
        return threadId;
    }

    public ContextState getContextState() {
        return contextState;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isPendingUserInput() {
        return pendingUserInput;
    }

    public String getPendingPrompt() {
        return pendingPrompt;
    }

    /// Returns the allowed answers of the pending input request.
    ///
    /// @return choices, or null when not paused or input is free-form
    public List<String> getPendingChoices() {
        return pendingChoices;
    }

    public Map<String, Object> getPendingPayload() {
        return pendingPayload;
    }

    public String getPendingSchemaRef() {
        return pendingSchemaRef;
    }

    public boolean isEscalationActive() {
        return escalationActive;
    }

    public List<String> getEscalationOptions() {
        return escalationOptions;
    }

    @Override
    public String toString() {
        return "ExecutionState{"
                + executionId
                + ", workflow="
                + workflowId
                + ", node="
                + currentNodeId
                + ", status="
                + status.wireValue()
                + "}";
    }

    public static final class Builder {
        private String executionId;
        private String workflowId;
        private String subjectId;
        private String documentType;
        private String userId;
        private Instant createdAt;
        private Instant updatedAt;
        private String currentNodeId;
        private ExecutionStatus status;
        private final List<NodeExecution> nodeHistory = new ArrayList<>();
        private final Map<String, Integer> retryCounts = new HashMap<>();
        private String generatingNodeId;
        private String gateOutcome;
        private String terminalOutcome;
        private String threadId;
        private ContextState contextState;
        private boolean pendingUserInput;
        private String pendingPrompt;
        private List<String> pendingChoices;
        private Map<String, Object> pendingPayload;
        private String pendingSchemaRef;
        private boolean escalationActive;
        private List<String> escalationOptions;

        private Builder() {}

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder documentType(String documentType) {
            this.documentType = documentType;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder currentNodeId(String currentNodeId) {
            this.currentNodeId = currentNodeId;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder nodeHistory(List<NodeExecution> nodeHistory) {
            this.nodeHistory.clear();
            this.nodeHistory.addAll(nodeHistory);
            return this;
        }

        public Builder retryCounts(Map<String, Integer> retryCounts) {
            this.retryCounts.clear();
            this.retryCounts.putAll(retryCounts);
            return this;
        }

        public Builder generatingNodeId(String generatingNodeId) {
            this.generatingNodeId = generatingNodeId;
            return this;
        }

        public Builder gateOutcome(String gateOutcome) {
            this.gateOutcome = gateOutcome;
            return this;
        }

        public Builder terminalOutcome(String terminalOutcome) {
            this.terminalOutcome = terminalOutcome;
            return this;
        }

        public Builder threadId(String threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder contextState(ContextState contextState) {
            this.contextState = contextState;
            return this;
        }

        public Builder pendingUserInput(boolean pendingUserInput) {
            this.pendingUserInput = pendingUserInput;
            return this;
        }

        public Builder pendingPrompt(String pendingPrompt) {
            this.pendingPrompt = pendingPrompt;
            return this;
        }

        public Builder pendingChoices(List<String> pendingChoices) {
            this.pendingChoices = pendingChoices;
            return this;
        }

        public Builder pendingPayload(Map<String, Object> pendingPayload) {
            this.pendingPayload = pendingPayload;
            return this;
        }

        public Builder pendingSchemaRef(String pendingSchemaRef) {
            this.pendingSchemaRef = pendingSchemaRef;
            return this;
        }

        public Builder escalationActive(boolean escalationActive) {
            this.escalationActive = escalationActive;
            return this;
        }

        public Builder escalationOptions(List<String> escalationOptions) {
            this.escalationOptions = escalationOptions;
            return this;
        }

        public ExecutionState build() {
            return new ExecutionState(this);
        }
    }
}
