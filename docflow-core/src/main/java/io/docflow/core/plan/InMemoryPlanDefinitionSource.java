package io.docflow.core.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Definition source backed by a list held in memory. Mostly useful in tests and
/// for embedding plans in code.
public class InMemoryPlanDefinitionSource implements PlanDefinitionSource {

    private final List<PlanDefinition> definitions = new ArrayList<>();

    public InMemoryPlanDefinitionSource add(String source, Map<String, Object> raw) {
        definitions.add(new PlanDefinition(source, raw));
        return this;
    }

    @Override
    public List<PlanDefinition> readAll() {
        return List.copyOf(definitions);
    }
}
