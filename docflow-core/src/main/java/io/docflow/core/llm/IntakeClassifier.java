package io.docflow.core.llm;

import java.util.List;
import java.util.Map;

/// Classifies intake text into one of an intake gate's outcomes.
@FunctionalInterface
public interface IntakeClassifier {

    /// @param input all intake text received so far, not null
    /// @param previousFrame facts extracted on earlier passes, never null
    /// @param allowedOutcomes outcomes the gate declares, may be empty
    /// @return classification, never null
    /// @throws CompletionException if classification needs an LLM call that failed
    IntakeClassification classify(
            String input, Map<String, Object> previousFrame, List<String> allowedOutcomes)
            throws CompletionException;
}
