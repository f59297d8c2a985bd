package io.docflow.core;

import io.docflow.core.execution.PlanExecutor;
import io.docflow.core.execution.executor.NodeExecutorRegistry;
import io.docflow.core.orchestration.ProjectOrchestrator;
import io.docflow.core.plan.PlanRegistry;
import io.docflow.core.state.ExecutionStateRepository;
import java.util.concurrent.ExecutorService;

/// Container holding the wired docflow components.
///
/// ### Contracts
/// - **Postcondition**: getters return the instances passed to the constructor
/// - **Invariant**: component references never change after construction
///
/// @apiNote Create instances via {@link DocflowFactory#builder()} rather than direct
/// construction.
///
/// @see DocflowFactory
public final class DocflowEnvironment implements AutoCloseable {

    private final DocflowConfig config;
    private final PlanRegistry planRegistry;
    private final ExecutionStateRepository stateRepository;
    private final NodeExecutorRegistry nodeExecutorRegistry;
    private final PlanExecutor planExecutor;
    private final ProjectOrchestrator orchestrator;
    private final ExecutorService executorService;

    public DocflowEnvironment(
            DocflowConfig config,
            PlanRegistry planRegistry,
            ExecutionStateRepository stateRepository,
            NodeExecutorRegistry nodeExecutorRegistry,
            PlanExecutor planExecutor,
            ProjectOrchestrator orchestrator,
            ExecutorService executorService) {
        this.config = config;
        this.planRegistry = planRegistry;
        this.stateRepository = stateRepository;
        this.nodeExecutorRegistry = nodeExecutorRegistry;
        this.planExecutor = planExecutor;
        this.orchestrator = orchestrator;
        this.executorService = executorService;
    }

    public DocflowConfig getConfig() {
        return config;
    }

    public PlanRegistry getPlanRegistry() {
        return planRegistry;
    }

    public ExecutionStateRepository getStateRepository() {
        return stateRepository;
    }

    public NodeExecutorRegistry getNodeExecutorRegistry() {
        return nodeExecutorRegistry;
    }

    public PlanExecutor getPlanExecutor() {
        return planExecutor;
    }

    public ProjectOrchestrator getOrchestrator() {
        return orchestrator;
    }

    /// Shuts down the orchestrator thread pool.
    ///
    /// @implNote Does not block; running tracks finish on their own.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
