package io.docflow.core.routing;

import io.docflow.core.exception.OutcomeMappingException;
import io.docflow.core.plan.OutcomeMappingEntry;
import io.docflow.core.plan.WorkflowPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Maps governance gate outcomes (e.g. `qualified`) to terminal outcomes
/// (e.g. `stabilized`).
///
/// Exact table lookup over the plan's declared mapping. No fallbacks, no guessing:
/// an unmapped gate outcome is an error.
public final class OutcomeMapper {

    private final Map<String, String> table;

    public OutcomeMapper(List<OutcomeMappingEntry> entries) {
        Map<String, String> map = new LinkedHashMap<>();
        for (OutcomeMappingEntry entry : entries) {
            map.put(entry.gateOutcome(), entry.terminalOutcome());
        }
        this.table = Collections.unmodifiableMap(map);
    }

    public static OutcomeMapper fromPlan(WorkflowPlan plan) {
        return new OutcomeMapper(plan.getOutcomeMapping());
    }

    /// Returns the terminal outcome of a gate outcome.
    ///
    /// @throws OutcomeMappingException listing the valid gate outcomes if unmapped
    public String map(String gateOutcome) throws OutcomeMappingException {
        String terminal = table.get(gateOutcome);
        if (terminal == null) {
            throw new OutcomeMappingException(gateOutcome, new ArrayList<>(table.keySet()));
        }
        return terminal;
    }

    public Optional<String> mapOptional(String gateOutcome) {
        return Optional.ofNullable(gateOutcome).map(table::get);
    }

    public boolean isMapped(String gateOutcome) {
        return table.containsKey(gateOutcome);
    }

    public Map<String, String> asMap() {
        return table;
    }
}
