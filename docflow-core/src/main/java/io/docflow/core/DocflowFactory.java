package io.docflow.core;

import io.docflow.core.execution.ExecutionListener;
import io.docflow.core.execution.OutcomeRecorder;
import io.docflow.core.execution.PlanExecutor;
import io.docflow.core.execution.executor.DefaultNodeExecutorRegistry;
import io.docflow.core.execution.executor.IntakeGateNodeExecutor;
import io.docflow.core.execution.executor.KeywordIntakeClassifier;
import io.docflow.core.execution.executor.NodeExecutor;
import io.docflow.core.execution.executor.NodeExecutorRegistry;
import io.docflow.core.execution.executor.QaNodeExecutor;
import io.docflow.core.execution.executor.TaskNodeExecutor;
import io.docflow.core.llm.CompletionService;
import io.docflow.core.llm.DocumentParser;
import io.docflow.core.llm.IntakeClassifier;
import io.docflow.core.llm.PromptLoader;
import io.docflow.core.llm.QaEvaluator;
import io.docflow.core.llm.SchemaValidator;
import io.docflow.core.orchestration.ProjectOrchestrator;
import io.docflow.core.plan.PlanRegistry;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ExecutionStateRepository;
import io.docflow.core.state.InMemoryExecutionStateRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for wiring docflow execution environments.
///
/// {@snippet :
/// try (var env = DocflowFactory.builder()
///         .config(DocflowConfig.fromProperties(properties))
///         .planRegistry(registry)
///         .completionService(llm, prompts, parser)
///         .build()) {
///     var state = env.getPlanExecutor().startExecution("project-1", "project_discovery", null);
/// }
/// }
///
/// Gate and end executors are always registered. Task and PGC executors are
/// registered when a completion service is supplied; the QA executor is always
/// registered, skipping the checks whose collaborators are absent. The intake gate
/// falls back to {@link KeywordIntakeClassifier}.
///
/// @see DocflowEnvironment
public final class DocflowFactory {

    private static final Logger logger = Logger.getLogger(DocflowFactory.class.getName());

    private DocflowFactory() {}

    /// Creates an environment with default configuration, an empty plan registry and
    /// in-memory state.
    public static DocflowEnvironment createEnvironment() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DocflowConfig config = new DocflowConfig();
        private PlanRegistry planRegistry;
        private ExecutionStateRepository stateRepository;
        private OutcomeRecorder outcomeRecorder = OutcomeRecorder.NOOP;
        private ExecutionListener listener = ExecutionListener.NOOP;
        private CompletionService completionService;
        private PromptLoader promptLoader;
        private DocumentParser documentParser;
        private SchemaValidator schemaValidator;
        private QaEvaluator qaEvaluator;
        private IntakeClassifier intakeClassifier;
        private final List<NodeExecutor> executors = new ArrayList<>();

        private Builder() {}

        public Builder config(DocflowConfig config) {
            this.config = config;
            return this;
        }

        public Builder planRegistry(PlanRegistry planRegistry) {
            this.planRegistry = planRegistry;
            return this;
        }

        public Builder stateRepository(ExecutionStateRepository stateRepository) {
            this.stateRepository = stateRepository;
            return this;
        }

        public Builder outcomeRecorder(OutcomeRecorder outcomeRecorder) {
            this.outcomeRecorder = outcomeRecorder;
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = listener;
            return this;
        }

        /// Enables task and PGC nodes.
        public Builder completionService(
                CompletionService completionService,
                PromptLoader promptLoader,
                DocumentParser documentParser) {
            this.completionService = completionService;
            this.promptLoader = promptLoader;
            this.documentParser = documentParser;
            return this;
        }

        public Builder schemaValidator(SchemaValidator schemaValidator) {
            this.schemaValidator = schemaValidator;
            return this;
        }

        public Builder qaEvaluator(QaEvaluator qaEvaluator) {
            this.qaEvaluator = qaEvaluator;
            return this;
        }

        public Builder intakeClassifier(IntakeClassifier intakeClassifier) {
            this.intakeClassifier = intakeClassifier;
            return this;
        }

        /// Registers a custom executor; it replaces the built-in one for its node type.
        public Builder nodeExecutor(NodeExecutor executor) {
            this.executors.add(executor);
            return this;
        }

        /// Builds the environment.
        ///
        /// @apiNote **Side effects**: creates a fixed thread pool of
        /// `orchestratorThreads` threads, released by {@link DocflowEnvironment#close()}.
        public DocflowEnvironment build() {
            PlanRegistry registry = planRegistry != null ? planRegistry : new PlanRegistry();
            ExecutionStateRepository repository =
                    stateRepository != null ? stateRepository : new InMemoryExecutionStateRepository();

            NodeExecutorRegistry executorRegistry = new DefaultNodeExecutorRegistry();
            if (completionService != null) {
                executorRegistry.register(
                        new TaskNodeExecutor(NodeType.TASK, completionService, promptLoader, documentParser));
                executorRegistry.register(
                        new TaskNodeExecutor(NodeType.PGC, completionService, promptLoader, documentParser));
            } else {
                logger.info("No completion service configured; task and pgc nodes are unavailable");
            }
            executorRegistry.register(new QaNodeExecutor(schemaValidator, qaEvaluator));
            executorRegistry.register(
                    new IntakeGateNodeExecutor(
                            intakeClassifier != null ? intakeClassifier : new KeywordIntakeClassifier()));
            executors.forEach(executorRegistry::register);

            PlanExecutor planExecutor =
                    new PlanExecutor(
                            registry,
                            repository,
                            executorRegistry,
                            outcomeRecorder,
                            listener,
                            config.getMaxSteps());
            ExecutorService executorService =
                    Executors.newFixedThreadPool(config.getOrchestratorThreads());
            ProjectOrchestrator orchestrator =
                    new ProjectOrchestrator(planExecutor, executorService, config);

            return new DocflowEnvironment(
                    config,
                    registry,
                    repository,
                    executorRegistry,
                    planExecutor,
                    orchestrator,
                    executorService);
        }
    }
}
