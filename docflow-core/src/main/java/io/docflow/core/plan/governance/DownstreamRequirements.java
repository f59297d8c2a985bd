package io.docflow.core.plan.governance;

import java.util.List;

/// Conditions downstream document types place on this plan's output.
///
/// @param conditions declared conditions, never null
/// @param description free text, may be null
public record DownstreamRequirements(List<String> conditions, String description) {

    public DownstreamRequirements {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }
}
