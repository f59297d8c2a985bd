package io.docflow.serialization.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docflow.core.state.ExecutionState;
import io.docflow.core.state.ExecutionStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class JsonFileExecutionStateRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir Path dir;

    private JsonFileExecutionStateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JsonFileExecutionStateRepository(dir.resolve("executions"));
    }

    private static ExecutionState execution(String id, String subject, Instant createdAt) {
        ExecutionState state =
                ExecutionState.builder()
                        .executionId(id)
                        .workflowId("project_discovery")
                        .subjectId(subject)
                        .currentNodeId("generate")
                        .createdAt(createdAt)
                        .updatedAt(createdAt)
                        .build();
        state.markRunning();
        return state;
    }

    @Test
    void shouldCreateStorageDirectory() {
        assertThat(repository.getDirectory()).isDirectory();
    }

    @Test
    void shouldPersistAcrossInstances() {
        ExecutionState state = execution("exec-1", "proj-1", T0);
        state.recordExecution("generate", "success", Map.of("produces", "project_discovery"));
        repository.save(state);

        var reopened = new JsonFileExecutionStateRepository(repository.getDirectory());

        assertThat(reopened.findByExecutionId("exec-1"))
                .get()
                .satisfies(s -> assertThat(s.getNodeHistory()).hasSize(1))
                .satisfies(s -> assertThat(s.getCreatedAt()).isEqualTo(T0));
        assertThat(repository.getDirectory().resolve("exec-1.json")).isRegularFile();
    }

    @Test
    void shouldReplaceOnSave() {
        ExecutionState state = execution("exec-1", "proj-1", T0);
        repository.save(state);
        state.advanceTo("qa");
        repository.save(state);

        assertThat(repository.findByExecutionId("exec-1").orElseThrow().getCurrentNodeId())
                .isEqualTo("qa");
        assertThat(repository.list(null, 10)).hasSize(1);
    }

    @Test
    void shouldReturnEmptyForUnknownId() {
        assertThat(repository.findByExecutionId("exec-missing")).isEmpty();
    }

    @Test
    void shouldFindMostRecentActiveExecution() {
        repository.save(execution("exec-old", "proj-1", T0));
        repository.save(execution("exec-new", "proj-1", T0.plusSeconds(60)));
        ExecutionState done = execution("exec-done", "proj-1", T0.plusSeconds(120));
        done.setCompleted("stabilized", null);
        repository.save(done);
        repository.save(execution("exec-other", "proj-2", T0.plusSeconds(180)));

        assertThat(repository.findActiveBySubject("proj-1", "project_discovery"))
                .get()
                .extracting(ExecutionState::getExecutionId)
                .isEqualTo("exec-new");
        assertThat(repository.findActiveBySubject("proj-1", "other_workflow")).isEmpty();
    }

    @Test
    void shouldListMostRecentFirstWithFilterAndLimit() {
        repository.save(execution("exec-a", "proj-1", T0));
        repository.save(execution("exec-b", "proj-1", T0.plusSeconds(1)));
        ExecutionState failed = execution("exec-c", "proj-1", T0.plusSeconds(2));
        failed.setFailed("boom");
        repository.save(failed);

        List<ExecutionState> running = repository.list(ExecutionStatus.RUNNING, 10);
        List<ExecutionState> latest = repository.list(null, 2);

        assertThat(running).extracting(ExecutionState::getExecutionId).containsExactly("exec-b", "exec-a");
        assertThat(latest).extracting(ExecutionState::getExecutionId).containsExactly("exec-c", "exec-b");
    }

    @Test
    void shouldSkipUnreadableFilesWhenListing() throws Exception {
        repository.save(execution("exec-a", "proj-1", T0));
        Files.writeString(repository.getDirectory().resolve("garbage.json"), "{oops");

        assertThat(repository.list(null, 10)).extracting(ExecutionState::getExecutionId).containsExactly("exec-a");
    }

    @ParameterizedTest
    @ValueSource(strings = {"../escape", "nested/id", "back\\slash"})
    void shouldRejectPathLikeIds(String executionId) {
        assertThatThrownBy(() -> repository.findByExecutionId(executionId))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid execution id");
    }
}
