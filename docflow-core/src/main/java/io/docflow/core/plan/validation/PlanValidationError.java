package io.docflow.core.plan.validation;

import java.util.Map;
import java.util.Objects;

/// Single validation finding, reported either as an error or as a warning.
///
/// @param code finding code, not null
/// @param message human-readable description, not null
/// @param path JSON path of the offending element, e.g. `$.edges[0].to_node_id`, may be null
/// @param context structured details such as offending ids, never null
public record PlanValidationError(
        PlanValidationErrorCode code, String message, String path, Map<String, Object> context) {

    public PlanValidationError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        context = context != null ? Map.copyOf(context) : Map.of();
    }

    public PlanValidationError(PlanValidationErrorCode code, String message, String path) {
        this(code, message, path, Map.of());
    }

    @Override
    public String toString() {
        return code + " at " + path + ": " + message;
    }
}
