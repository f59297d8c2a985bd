package io.docflow.core.plan;

import java.util.Map;
import java.util.Objects;

/// Raw plan definition as read from a {@link PlanDefinitionSource}.
///
/// @param source where the definition came from, used in error messages, not null
/// @param raw JSON-shaped definition tree, not null
public record PlanDefinition(String source, Map<String, Object> raw) {

    public PlanDefinition {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(raw, "raw");
    }
}
