package io.docflow.core.plan;

import io.docflow.core.exception.PlanLoadException;
import io.docflow.core.exception.PlanNotFoundException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// In-memory cache of loaded plans keyed by workflow id and by document type.
///
/// One plan wins per document type: the last one registered or replaced. The
/// registry is an ordinary instance passed to whoever needs it; the expected
/// lifecycle is a single {@link #load(PlanLoader, PlanDefinitionSource)} at startup
/// followed by reads.
///
/// @implNote Thread-safe. Reads take no locks.
public class PlanRegistry {

    private static final Logger logger = Logger.getLogger(PlanRegistry.class.getName());

    private final Map<String, WorkflowPlan> plansById = new ConcurrentHashMap<>();
    private final Map<String, WorkflowPlan> plansByDocumentType = new ConcurrentHashMap<>();

    /// Creates an empty registry for tests.
    public static PlanRegistry forTesting() {
        return new PlanRegistry();
    }

    /// Registers a plan under a new workflow id.
    ///
    /// @param plan plan to register, not null
    /// @throws IllegalStateException if a plan with the same workflow id is registered
    public void register(WorkflowPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        if (plansById.putIfAbsent(plan.getWorkflowId(), plan) != null) {
            throw new IllegalStateException(
                    "Plan already registered: " + plan.getWorkflowId());
        }
        plansByDocumentType.put(plan.getDocumentType(), plan);
        logger.info("Registered plan " + plan);
    }

    /// Registers or replaces a plan and re-points its document type at it.
    ///
    /// @param plan plan to register, not null
    public void replace(WorkflowPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        WorkflowPlan previous = plansById.put(plan.getWorkflowId(), plan);
        if (previous != null && !previous.getDocumentType().equals(plan.getDocumentType())) {
            plansByDocumentType.remove(previous.getDocumentType(), previous);
        }
        plansByDocumentType.put(plan.getDocumentType(), plan);
        logger.info((previous != null ? "Replaced plan " : "Registered plan ") + plan);
    }

    /// Returns the plan with the given workflow id.
    ///
    /// @throws PlanNotFoundException if no such plan is registered
    public WorkflowPlan get(String workflowId) throws PlanNotFoundException {
        WorkflowPlan plan = plansById.get(workflowId);
        if (plan == null) {
            throw new PlanNotFoundException(workflowId);
        }
        return plan;
    }

    public Optional<WorkflowPlan> getByDocumentType(String documentType) {
        return Optional.ofNullable(plansByDocumentType.get(documentType));
    }

    /// Returns all plans ordered by workflow id.
    ///
    /// @return snapshot list, never null
    public List<WorkflowPlan> list() {
        List<WorkflowPlan> plans = new ArrayList<>(plansById.values());
        plans.sort(Comparator.comparing(WorkflowPlan::getWorkflowId));
        return plans;
    }

    public int size() {
        return plansById.size();
    }

    /// Loads every definition from a source, replacing plans with the same id.
    ///
    /// @return number of plans loaded
    /// @throws PlanLoadException if any definition cannot be read or is invalid; nothing
    ///     is registered in that case
    public int load(PlanLoader loader, PlanDefinitionSource source) throws PlanLoadException {
        List<WorkflowPlan> plans = loader.loadAll(source);
        plans.forEach(this::replace);
        logger.info("Loaded " + plans.size() + " plan(s)");
        return plans.size();
    }

    /// Removes every plan.
    public void reset() {
        plansById.clear();
        plansByDocumentType.clear();
    }
}
