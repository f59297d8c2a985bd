package io.docflow.core.execution.executor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable fact reported by a node executor.
///
/// A result says what happened (an outcome string plus optional artifacts); it never
/// says what happens next. Routing belongs to the plan executor and the edge router.
///
/// ### Factory Methods
/// - {@link #success()} / {@link #success(Map)} for completed work
/// - {@link #failed(String)} for a failure the plan routes on
/// - {@link #needsInput(String, List)} to pause for a human answer
/// - {@link #of(String)} for any other outcome
///
/// @implNote Immutable after construction. Metadata is wrapped in an unmodifiable view.
public final class NodeResult {

    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";
    public static final String BLOCKED = "blocked";
    public static final String NEEDS_USER_INPUT = "needs_user_input";

    private final String outcome;
    private final Map<String, Object> producedDocument;
    private final boolean requiresUserInput;
    private final String userPrompt;
    private final List<String> userChoices;
    private final Map<String, Object> payload;
    private final String schemaRef;
    private final Map<String, Object> metadata;

    private NodeResult(Builder builder) {
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome");
        this.producedDocument = builder.producedDocument;
        this.requiresUserInput = builder.requiresUserInput;
        this.userPrompt = builder.userPrompt;
        this.userChoices = builder.userChoices != null ? List.copyOf(builder.userChoices) : null;
        this.payload = builder.payload;
        this.schemaRef = builder.schemaRef;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder(String outcome) {
        return new Builder().outcome(outcome);
    }

    public static NodeResult of(String outcome) {
        return builder(outcome).build();
    }

    public static NodeResult success() {
        return of(SUCCESS);
    }

    public static NodeResult success(Map<String, Object> producedDocument) {
        return builder(SUCCESS).producedDocument(producedDocument).build();
    }

    /// Creates a `failed` result with the reason recorded in metadata.
    public static NodeResult failed(String reason) {
        return builder(FAILED).metadata("reason", reason).build();
    }

    /// Creates a result that pauses the execution for input.
    ///
    /// @param prompt human-readable prompt, not null
    /// @param choices allowed answers, null for free input
    public static NodeResult needsInput(String prompt, List<String> choices) {
        return builder(NEEDS_USER_INPUT).requiresUserInput(prompt, choices).build();
    }

    public String getOutcome() {
        return outcome;
    }

    /// Returns the produced document, if any.
    ///
    /// @return document, may be null
    public Map<String, Object> getProducedDocument() {
        return producedDocument;
    }

    public boolean isRequiresUserInput() {
        return requiresUserInput;
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    public List<String> getUserChoices() {
        return userChoices;
    }

    /// Returns the structured input request, if any.
    ///
    /// @return payload, may be null
    public Map<String, Object> getPayload() {
        return payload;
    }

    public String getSchemaRef() {
        return schemaRef;
    }

    /// Returns executor metadata.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "NodeResult{" + outcome + (requiresUserInput ? ", awaiting input" : "") + "}";
    }

    public static final class Builder {
        private String outcome;
        private Map<String, Object> producedDocument;
        private boolean requiresUserInput;
        private String userPrompt;
        private List<String> userChoices;
        private Map<String, Object> payload;
        private String schemaRef;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder outcome(String outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder producedDocument(Map<String, Object> producedDocument) {
            this.producedDocument = producedDocument;
            return this;
        }

        public Builder requiresUserInput(String prompt, List<String> choices) {
            this.requiresUserInput = true;
            this.userPrompt = prompt;
            this.userChoices = choices;
            return this;
        }

        public Builder payload(Map<String, Object> payload, String schemaRef) {
            this.payload = payload;
            this.schemaRef = schemaRef;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.putAll(metadata);
            return this;
        }

        public NodeResult build() {
            return new NodeResult(this);
        }
    }
}
