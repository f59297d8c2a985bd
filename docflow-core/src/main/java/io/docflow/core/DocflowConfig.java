package io.docflow.core;

import java.time.Duration;
import java.util.Properties;

/// Configuration options for the docflow execution environment.
///
/// Use the {@link Builder} for fluent configuration, the setters for mutable
/// configuration, or {@link #fromProperties(Properties)} to read `docflow.*` keys.
///
/// ### Default Values
/// | Property                                  | Default |
/// |-------------------------------------------|---------|
/// | `docflow.execution.max-steps`              | `100`   |
/// | `docflow.orchestrator.threads`             | `4`     |
/// | `docflow.orchestrator.max-iterations`      | `100`   |
/// | `docflow.orchestrator.poll-interval-ms`    | `1000`  |
/// | `docflow.orchestrator.max-poll-attempts`   | `30`    |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link DocflowFactory};
/// do not modify after environment creation.
public class DocflowConfig {

    public static final String MAX_STEPS = "docflow.execution.max-steps";
    public static final String ORCHESTRATOR_THREADS = "docflow.orchestrator.threads";
    public static final String MAX_ITERATIONS = "docflow.orchestrator.max-iterations";
    public static final String POLL_INTERVAL_MS = "docflow.orchestrator.poll-interval-ms";
    public static final String MAX_POLL_ATTEMPTS = "docflow.orchestrator.max-poll-attempts";

    private int maxSteps = 100;
    private int orchestratorThreads = 4;
    private int maxOrchestrationIterations = 100;
    private Duration pollInterval = Duration.ofSeconds(1);
    private int maxPollAttempts = 30;

    public DocflowConfig() {}

    /// Reads configuration from properties; absent keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a value is not a positive integer
    public static DocflowConfig fromProperties(Properties properties) {
        DocflowConfig config = new DocflowConfig();
        config.setMaxSteps(intProperty(properties, MAX_STEPS, config.maxSteps));
        config.setOrchestratorThreads(
                intProperty(properties, ORCHESTRATOR_THREADS, config.orchestratorThreads));
        config.setMaxOrchestrationIterations(
                intProperty(properties, MAX_ITERATIONS, config.maxOrchestrationIterations));
        config.setPollInterval(
                Duration.ofMillis(
                        intProperty(properties, POLL_INTERVAL_MS, (int) config.pollInterval.toMillis())));
        config.setMaxPollAttempts(intProperty(properties, MAX_POLL_ATTEMPTS, config.maxPollAttempts));
        return config;
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new IllegalArgumentException(key + " must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }

    /// Returns the step budget of `runToCompletionOrPause` when none is given.
    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    /// Returns the size of the thread pool that drives document tracks concurrently.
    public int getOrchestratorThreads() {
        return orchestratorThreads;
    }

    public void setOrchestratorThreads(int orchestratorThreads) {
        this.orchestratorThreads = orchestratorThreads;
    }

    public int getMaxOrchestrationIterations() {
        return maxOrchestrationIterations;
    }

    public void setMaxOrchestrationIterations(int maxOrchestrationIterations) {
        this.maxOrchestrationIterations = maxOrchestrationIterations;
    }

    /// Returns the sleep between polls while waiting for human input.
    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxPollAttempts() {
        return maxPollAttempts;
    }

    public void setMaxPollAttempts(int maxPollAttempts) {
        this.maxPollAttempts = maxPollAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final DocflowConfig config = new DocflowConfig();

        private Builder() {}

        public Builder maxSteps(int maxSteps) {
            config.setMaxSteps(maxSteps);
            return this;
        }

        public Builder orchestratorThreads(int threads) {
            config.setOrchestratorThreads(threads);
            return this;
        }

        public Builder maxOrchestrationIterations(int iterations) {
            config.setMaxOrchestrationIterations(iterations);
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            config.setPollInterval(pollInterval);
            return this;
        }

        public Builder maxPollAttempts(int attempts) {
            config.setMaxPollAttempts(attempts);
            return this;
        }

        public DocflowConfig build() {
            return config;
        }
    }
}
