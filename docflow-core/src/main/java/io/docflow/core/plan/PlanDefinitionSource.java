package io.docflow.core.plan;

import io.docflow.core.exception.PlanLoadException;
import java.util.List;

/// Supplies raw plan definitions to a {@link PlanLoader}.
///
/// Implementations decide where definitions live and which version of a plan
/// family is active; they return exactly one definition per workflow.
///
/// @see InMemoryPlanDefinitionSource
public interface PlanDefinitionSource {

    /// Reads every active definition this source knows about.
    ///
    /// @return definitions, never null
    /// @throws PlanLoadException if a definition cannot be read
    List<PlanDefinition> readAll() throws PlanLoadException;
}
