package io.docflow.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a gate outcome has no entry in a plan's outcome mapping.
public final class OutcomeMappingException extends DocflowException {

    @Serial private static final long serialVersionUID = 9L;

    private final String gateOutcome;
    private final List<String> validGateOutcomes;

    public OutcomeMappingException(String gateOutcome, List<String> validGateOutcomes) {
        super("Unmapped gate outcome '" + gateOutcome + "', valid: " + validGateOutcomes);
        this.gateOutcome = gateOutcome;
        this.validGateOutcomes = List.copyOf(validGateOutcomes);
    }

    public String getGateOutcome() {
        return gateOutcome;
    }

    public List<String> getValidGateOutcomes() {
        return validGateOutcomes;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.OUTCOME_MAPPING;
    }
}
