package io.docflow.core.llm;

import java.util.List;

/// @param valid whether the document conforms
/// @param errors violations, empty when valid, never null
public record SchemaValidationResult(boolean valid, List<String> errors) {

    public static final SchemaValidationResult VALID = new SchemaValidationResult(true, List.of());

    public SchemaValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static SchemaValidationResult invalid(List<String> errors) {
        return new SchemaValidationResult(false, errors);
    }
}
