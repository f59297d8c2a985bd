package io.docflow.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DocflowConfigTest {

    @Test
    void shouldUseDefaults() {
        DocflowConfig config = new DocflowConfig();

        assertThat(config.getMaxSteps()).isEqualTo(100);
        assertThat(config.getOrchestratorThreads()).isEqualTo(4);
        assertThat(config.getMaxOrchestrationIterations()).isEqualTo(100);
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getMaxPollAttempts()).isEqualTo(30);
    }

    @Test
    void shouldReadProperties() {
        Properties properties = new Properties();
        properties.setProperty(DocflowConfig.MAX_STEPS, "25");
        properties.setProperty(DocflowConfig.ORCHESTRATOR_THREADS, " 2 ");
        properties.setProperty(DocflowConfig.POLL_INTERVAL_MS, "50");

        DocflowConfig config = DocflowConfig.fromProperties(properties);

        assertThat(config.getMaxSteps()).isEqualTo(25);
        assertThat(config.getOrchestratorThreads()).isEqualTo(2);
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMillis(50));
        assertThat(config.getMaxPollAttempts()).isEqualTo(30);
    }

    @Test
    void shouldKeepDefaultForBlankProperty() {
        Properties properties = new Properties();
        properties.setProperty(DocflowConfig.MAX_ITERATIONS, "  ");

        assertThat(DocflowConfig.fromProperties(properties).getMaxOrchestrationIterations())
                .isEqualTo(100);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-3", "ten", "1.5"})
    void shouldRejectInvalidValue(String value) {
        Properties properties = new Properties();
        properties.setProperty(DocflowConfig.MAX_STEPS, value);

        assertThatThrownBy(() -> DocflowConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(DocflowConfig.MAX_STEPS);
    }

    @Test
    void shouldBuildConfig() {
        DocflowConfig config =
                DocflowConfig.builder()
                        .maxSteps(7)
                        .orchestratorThreads(1)
                        .maxOrchestrationIterations(3)
                        .pollInterval(Duration.ofMillis(10))
                        .maxPollAttempts(4)
                        .build();

        assertThat(config.getMaxSteps()).isEqualTo(7);
        assertThat(config.getOrchestratorThreads()).isEqualTo(1);
        assertThat(config.getMaxOrchestrationIterations()).isEqualTo(3);
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMillis(10));
        assertThat(config.getMaxPollAttempts()).isEqualTo(4);
    }
}
