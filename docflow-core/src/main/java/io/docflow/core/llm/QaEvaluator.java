package io.docflow.core.llm;

/// Semantic QA capability used by the QA executor after the structural check.
@FunctionalInterface
public interface QaEvaluator {

    /// @param documentType type of the document under review, may be null
    /// @param document document to judge, not null
    /// @return verdict, never null
    /// @throws CompletionException if the judgement could not be obtained
    QaVerdict evaluate(String documentType, Object document) throws CompletionException;
}
