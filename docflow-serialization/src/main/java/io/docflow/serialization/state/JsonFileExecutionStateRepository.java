package io.docflow.serialization.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.state.ExecutionState;
import io.docflow.core.state.ExecutionStateRepository;
import io.docflow.core.state.ExecutionStatus;
import io.docflow.serialization.ExecutionStateSerializer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// File-backed {@link ExecutionStateRepository} storing one JSON document per execution.
///
/// Files are named `<executionId>.json` under the storage directory and are replaced
/// atomically on every save, so a crash never leaves a half-written execution.
/// Executions survive process restarts.
///
/// @implNote Thread-safe. All operations synchronize on the repository; queries scan
/// the directory and are meant for modest execution counts.
public class JsonFileExecutionStateRepository implements ExecutionStateRepository {

    private static final Logger logger =
            Logger.getLogger(JsonFileExecutionStateRepository.class.getName());

    private static final String SUFFIX = ".json";

    private static final Comparator<ExecutionSnapshot> MOST_RECENT_FIRST =
            Comparator.comparing(
                            ExecutionSnapshot::createdAt,
                            Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(ExecutionSnapshot::executionId)
                    .reversed();

    private final Path directory;
    private final ObjectMapper objectMapper;

    /// @param directory storage directory, created if missing, not null
    /// @throws UncheckedIOException if the directory cannot be created
    public JsonFileExecutionStateRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.objectMapper = ExecutionStateSerializer.createMapper();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create state directory " + directory, e);
        }
    }

    @Override
    public synchronized void save(ExecutionState state) {
        Path target = fileFor(state.getExecutionId());
        Path temp = directory.resolve(state.getExecutionId() + SUFFIX + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), ExecutionSnapshot.from(state));
            Files.move(
                    temp,
                    target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot save execution " + state.getExecutionId(), e);
        }
    }

    @Override
    public synchronized Optional<ExecutionState> findByExecutionId(String executionId) {
        Path file = fileFor(executionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file).toState());
    }

    @Override
    public synchronized Optional<ExecutionState> findActiveBySubject(
            String subjectId, String workflowId) {
        return readAll().stream()
                .filter(s -> s.subjectId().equals(subjectId))
                .filter(s -> s.workflowId().equals(workflowId))
                .filter(s -> !s.status().isTerminal())
                .sorted(MOST_RECENT_FIRST)
                .findFirst()
                .map(ExecutionSnapshot::toState);
    }

    @Override
    public synchronized List<ExecutionState> list(ExecutionStatus statusFilter, int limit) {
        return readAll().stream()
                .filter(s -> statusFilter == null || s.status() == statusFilter)
                .sorted(MOST_RECENT_FIRST)
                .limit(limit)
                .map(ExecutionSnapshot::toState)
                .collect(Collectors.toList());
    }

    public Path getDirectory() {
        return directory;
    }

    private List<ExecutionSnapshot> readAll() {
        List<ExecutionSnapshot> snapshots = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(f -> f.getFileName().toString().endsWith(SUFFIX))
                    .collect(Collectors.toList())) {
                try {
                    snapshots.add(read(file));
                } catch (UncheckedIOException e) {
                    logger.log(Level.WARNING, "Skipping unreadable execution file " + file, e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list state directory " + directory, e);
        }
        return snapshots;
    }

    private ExecutionSnapshot read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), ExecutionSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read execution file " + file, e);
        }
    }

    private Path fileFor(String executionId) {
        if (executionId.contains("/") || executionId.contains("\\") || executionId.contains("..")) {
            throw new IllegalArgumentException("Invalid execution id: " + executionId);
        }
        return directory.resolve(executionId + SUFFIX);
    }
}
