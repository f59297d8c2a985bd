package io.docflow.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when an escalation choice is not among the offered options.
public final class InvalidEscalationChoiceException extends DocflowException {

    @Serial private static final long serialVersionUID = 5L;

    private final String choice;
    private final List<String> options;

    public InvalidEscalationChoiceException(String choice, List<String> options) {
        super("Invalid escalation choice '" + choice + "', expected one of " + options);
        this.choice = choice;
        this.options = List.copyOf(options);
    }

    public String getChoice() {
        return choice;
    }

    public List<String> getOptions() {
        return options;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INVALID_ESCALATION_CHOICE;
    }
}
