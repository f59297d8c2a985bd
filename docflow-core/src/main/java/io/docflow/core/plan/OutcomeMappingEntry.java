package io.docflow.core.plan;

import java.util.Objects;

/// One row of a plan's outcome mapping: governance gate outcome to terminal outcome.
///
/// @param gateOutcome governance vocabulary value, e.g. `qualified`, not null
/// @param terminalOutcome execution vocabulary value, e.g. `stabilized`, not null
public record OutcomeMappingEntry(String gateOutcome, String terminalOutcome) {

    public OutcomeMappingEntry {
        Objects.requireNonNull(gateOutcome, "gateOutcome");
        Objects.requireNonNull(terminalOutcome, "terminalOutcome");
    }
}
