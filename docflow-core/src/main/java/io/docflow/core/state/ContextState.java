package io.docflow.core.state;

import io.docflow.core.util.RawMaps;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Governed key-value accumulator carried across node executions.
///
/// Keys belong to closed namespaces, one per producer:
///
/// | Key                    | Written by                   |
/// |------------------------|------------------------------|
/// | `document_<produces>`  | generation nodes             |
/// | `pgc_questions`        | clarification nodes          |
/// | `pgc_answers`          | caller input to clarification|
/// | `pgc_invariants`       | caller / clarification merge |
/// | `qa_feedback`          | QA nodes                     |
/// | `intake_summary`       | intake gates                 |
/// | `user_input`           | caller                       |
/// | `gate_answers`         | gate input, keyed by node id |
///
/// Merges are shallow: a key present in the delta replaces the stored value
/// entirely, nested structures are never merged. A null value in the delta
/// removes the key. Only structured derived facts belong here, never raw
/// conversation transcripts.
///
/// @implNote Deeply immutable: stored values are frozen copies, so nested documents
/// handed out by the accessors cannot be changed. Every merge returns a new instance.
public final class ContextState {

    public static final String DOCUMENT_PREFIX = "document_";
    public static final String PGC_QUESTIONS = "pgc_questions";
    public static final String PGC_ANSWERS = "pgc_answers";
    public static final String PGC_INVARIANTS = "pgc_invariants";
    public static final String QA_FEEDBACK = "qa_feedback";
    public static final String INTAKE_SUMMARY = "intake_summary";
    public static final String USER_INPUT = "user_input";
    public static final String GATE_ANSWERS = "gate_answers";

    private static final Set<String> FIXED_KEYS =
            Set.of(
                    PGC_QUESTIONS,
                    PGC_ANSWERS,
                    PGC_INVARIANTS,
                    QA_FEEDBACK,
                    INTAKE_SUMMARY,
                    USER_INPUT,
                    GATE_ANSWERS);

    public static final ContextState EMPTY = new ContextState(Map.of());

    private final Map<String, Object> values;

    private ContextState(Map<String, Object> values) {
        this.values = RawMaps.freezeMap(values);
    }

    /// Creates a context from raw values.
    ///
    /// @param values initial values, may be null
    /// @return new context, never null
    /// @throws IllegalArgumentException if a key is outside the governed namespaces
    public static ContextState of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return EMPTY.merge(values);
    }

    /// Returns whether a key belongs to one of the governed namespaces.
    public static boolean isGovernedKey(String key) {
        return key != null
                && (FIXED_KEYS.contains(key)
                        || (key.startsWith(DOCUMENT_PREFIX) && key.length() > DOCUMENT_PREFIX.length()));
    }

    public static String documentKey(String produces) {
        return DOCUMENT_PREFIX + produces;
    }

    /// Shallow-merges a delta, replacing keys wholesale.
    ///
    /// @param delta keys to set; null values remove the key, not null
    /// @return merged context, never null
    /// @throws IllegalArgumentException if a key is outside the governed namespaces
    public ContextState merge(Map<String, Object> delta) {
        Map<String, Object> merged = new LinkedHashMap<>(values);
        for (Map.Entry<String, Object> entry : delta.entrySet()) {
            if (!isGovernedKey(entry.getKey())) {
                throw new IllegalArgumentException(
                        "Context key outside governed namespaces: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                merged.remove(entry.getKey());
            } else {
                merged.put(entry.getKey(), entry.getValue());
            }
        }
        return new ContextState(merged);
    }

    public Optional<Object> document(String produces) {
        return Optional.ofNullable(values.get(documentKey(produces)));
    }

    /// Returns produced documents keyed by their `produces` name.
    ///
    /// @return new map in insertion order, never null
    public Map<String, Object> documents() {
        Map<String, Object> documents = new LinkedHashMap<>();
        values.forEach(
                (key, value) -> {
                    if (key.startsWith(DOCUMENT_PREFIX)) {
                        documents.put(key.substring(DOCUMENT_PREFIX.length()), value);
                    }
                });
        return documents;
    }

    public Optional<String> userInput() {
        return values.get(USER_INPUT) instanceof String input ? Optional.of(input) : Optional.empty();
    }

    public Map<String, Object> qaFeedback() {
        Map<String, Object> feedback = RawMaps.asMap(values.get(QA_FEEDBACK));
        return feedback != null ? feedback : Map.of();
    }

    public List<Object> pgcInvariants() {
        List<Object> invariants = RawMaps.asList(values.get(PGC_INVARIANTS));
        return invariants != null ? invariants : List.of();
    }

    public Optional<Object> pgcQuestions() {
        return Optional.ofNullable(values.get(PGC_QUESTIONS));
    }

    public Optional<Object> pgcAnswers() {
        return Optional.ofNullable(values.get(PGC_ANSWERS));
    }

    public Optional<Object> intakeSummary() {
        return Optional.ofNullable(values.get(INTAKE_SUMMARY));
    }

    /// Returns the recorded answer of a gate.
    ///
    /// @param nodeId gate node id, not null
    /// @return the answer, or empty if the gate was never answered
    public Optional<String> gateAnswer(String nodeId) {
        if (values.get(GATE_ANSWERS) instanceof Map<?, ?> answers
                && answers.get(nodeId) instanceof String answer) {
            return Optional.of(answer);
        }
        return Optional.empty();
    }

    /// Returns the `gate_answers` value with one more answer recorded.
    public Map<String, Object> gateAnswersWith(String nodeId, String answer) {
        Map<String, Object> existing = RawMaps.asMap(values.get(GATE_ANSWERS));
        Map<String, Object> answers = existing != null ? existing : new LinkedHashMap<>();
        answers.put(nodeId, answer);
        return answers;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    /// Returns the raw values.
    ///
    /// @return deeply unmodifiable map, never null
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ContextState other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ContextState" + values.keySet();
    }
}
