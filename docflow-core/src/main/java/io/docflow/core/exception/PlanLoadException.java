package io.docflow.core.exception;

import io.docflow.core.plan.validation.PlanValidationError;
import java.io.Serial;
import java.util.List;

/// Thrown when a plan definition cannot be turned into a plan.
///
/// Carries at most {@link #MAX_REPORTED_ERRORS} validation errors; the number of
/// errors left out is reported separately.
public final class PlanLoadException extends DocflowException {

    @Serial private static final long serialVersionUID = -2313097625530144212L;

    public static final int MAX_REPORTED_ERRORS = 5;

    private final String source;
    private final transient List<PlanValidationError> errors;
    private final int omittedErrorCount;

    public PlanLoadException(String source, List<PlanValidationError> allErrors) {
        super(describe(source, allErrors));
        this.source = source;
        this.errors = List.copyOf(allErrors.subList(0, Math.min(MAX_REPORTED_ERRORS, allErrors.size())));
        this.omittedErrorCount = Math.max(0, allErrors.size() - MAX_REPORTED_ERRORS);
    }

    public PlanLoadException(String source, String message, Throwable cause) {
        super("Failed to load plan from " + source + ": " + message, cause);
        this.source = source;
        this.errors = List.of();
        this.omittedErrorCount = 0;
    }

    public String getSource() {
        return source;
    }

    /// Returns the reported validation errors.
    ///
    /// @return at most {@link #MAX_REPORTED_ERRORS} errors, never null
    public List<PlanValidationError> getErrors() {
        return errors;
    }

    public int getOmittedErrorCount() {
        return omittedErrorCount;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PLAN_LOAD;
    }

    private static String describe(String source, List<PlanValidationError> errors) {
        StringBuilder message = new StringBuilder("Invalid plan definition ").append(source).append(':');
        errors.stream()
                .limit(MAX_REPORTED_ERRORS)
                .forEach(e -> message.append("\n  - ").append(e));
        if (errors.size() > MAX_REPORTED_ERRORS) {
            message.append("\n  ... and ").append(errors.size() - MAX_REPORTED_ERRORS).append(" more");
        }
        return message.toString();
    }
}
