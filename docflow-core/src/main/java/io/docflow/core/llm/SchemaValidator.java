package io.docflow.core.llm;

/// Optional structural check of produced documents, used by the QA executor.
@FunctionalInterface
public interface SchemaValidator {

    /// @param document document to check, not null
    /// @param schemaRef schema reference, e.g. the produced document type, not null
    /// @return result, never null
    SchemaValidationResult validate(Object document, String schemaRef);
}
