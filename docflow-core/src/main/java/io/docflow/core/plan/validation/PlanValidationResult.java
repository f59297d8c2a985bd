package io.docflow.core.plan.validation;

import java.util.List;

/// Outcome of validating a raw plan definition.
///
/// A definition is valid when it has no errors; warnings never affect validity.
///
/// @param errors blocking findings in discovery order, never null
/// @param warnings non-blocking findings, never null
public record PlanValidationResult(
        List<PlanValidationError> errors, List<PlanValidationError> warnings) {

    public PlanValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    public boolean hasErrorCode(PlanValidationErrorCode code) {
        return errors.stream().anyMatch(e -> e.code() == code);
    }

    public boolean hasWarningCode(PlanValidationErrorCode code) {
        return warnings.stream().anyMatch(e -> e.code() == code);
    }
}
