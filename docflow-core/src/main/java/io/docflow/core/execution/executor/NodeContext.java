package io.docflow.core.execution.executor;

import io.docflow.core.llm.ChatMessage;
import io.docflow.core.state.ContextState;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Per-step working context handed to a node executor.
///
/// Unlike the execution state, the context is mutable and scoped to one step:
/// executors may add documents, messages and scratch values, and none of it outlives
/// the step unless the plan executor picks it up from the {@link NodeResult}.
///
/// ### Contents
/// - identity of the execution (ids, subject, document type)
/// - the submitted user input or choice, if the step resumes a pause
/// - a read-only copy of the governed {@link ContextState}
/// - produced documents available as inputs, keyed by `produces`
/// - conversation history for LLM calls
public final class NodeContext {

    private final String executionId;
    private final String workflowId;
    private final String subjectId;
    private final String documentType;
    private final String userInput;
    private final String userChoice;
    private final ContextState contextState;
    private final Map<String, Object> documentContent;
    private final List<ChatMessage> conversationHistory;
    private final Map<String, Object> extra;

    private NodeContext(Builder builder) {
        this.executionId = builder.executionId;
        this.workflowId = builder.workflowId;
        this.subjectId = builder.subjectId;
        this.documentType = builder.documentType;
        this.userInput = builder.userInput;
        this.userChoice = builder.userChoice;
        this.contextState = builder.contextState != null ? builder.contextState : ContextState.EMPTY;
        this.documentContent = new LinkedHashMap<>(this.contextState.documents());
        this.conversationHistory = new ArrayList<>(builder.conversationHistory);
        this.extra = new HashMap<>(builder.extra);
    }

    public static Builder builder() {
        return new Builder();
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

    /// Returns free-text input submitted with this step.
    public Optional<String> getUserInput() {
        return Optional.ofNullable(userInput).filter(s -> !s.isBlank());
    }

    /// Returns the choice submitted with this step.
    public Optional<String> getUserChoice() {
        return Optional.ofNullable(userChoice).filter(s -> !s.isBlank());
    }

    public ContextState getContextState() {
        return contextState;
    }

    /// Returns documents available to this step keyed by `produces`.
    ///
    /// @return mutable map scoped to this step, never null
    public Map<String, Object> getDocumentContent() {
        return documentContent;
    }

    /// @return mutable list scoped to this step, never null
    public List<ChatMessage> getConversationHistory() {
        return conversationHistory;
    }

    /// @return mutable map scoped to this step, never null
    public Map<String, Object> getExtra() {
        return extra;
    }

    public static final class Builder {
        private String executionId;
        private String workflowId;
        private String subjectId;
        private String documentType;
        private String userInput;
        private String userChoice;
        private ContextState contextState;
        private final List<ChatMessage> conversationHistory = new ArrayList<>();
        private final Map<String, Object> extra = new HashMap<>();

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

        public Builder userInput(String userInput) {
            this.userInput = userInput;
            return this;
        }

        public Builder userChoice(String userChoice) {
            this.userChoice = userChoice;
            return this;
        }

        public Builder contextState(ContextState contextState) {
            this.contextState = contextState;
            return this;
        }

        public Builder message(ChatMessage message) {
            this.conversationHistory.add(message);
            return this;
        }

        public Builder extra(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public NodeContext build() {
            return new NodeContext(this);
        }
    }
}
