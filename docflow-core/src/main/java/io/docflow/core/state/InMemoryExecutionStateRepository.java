package io.docflow.core.state;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/// Execution state repository backed by a {@link ConcurrentHashMap} of snapshots.
///
/// States are stored as deeply frozen {@link ExecutionSnapshot}s, so callers never
/// share mutable instances, nested maps included, with the store.
public class InMemoryExecutionStateRepository implements ExecutionStateRepository {

    static final Comparator<ExecutionSnapshot> MOST_RECENT_FIRST =
            Comparator.comparing(ExecutionSnapshot::createdAt)
                    .thenComparing(ExecutionSnapshot::executionId)
                    .reversed();

    private final Map<String, ExecutionSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(ExecutionState state) {
        Objects.requireNonNull(state, "state must not be null");
        snapshots.put(state.getExecutionId(), ExecutionSnapshot.from(state));
    }

    @Override
    public Optional<ExecutionState> findByExecutionId(String executionId) {
        return Optional.ofNullable(snapshots.get(executionId)).map(ExecutionSnapshot::toState);
    }

    @Override
    public Optional<ExecutionState> findActiveBySubject(String subjectId, String workflowId) {
        return snapshots.values().stream()
                .filter(s -> s.subjectId().equals(subjectId))
                .filter(s -> s.workflowId().equals(workflowId))
                .filter(s -> !s.status().isTerminal())
                .sorted(MOST_RECENT_FIRST)
                .findFirst()
                .map(ExecutionSnapshot::toState);
    }

    @Override
    public List<ExecutionState> list(ExecutionStatus statusFilter, int limit) {
        return snapshots.values().stream()
                .filter(s -> statusFilter == null || s.status() == statusFilter)
                .sorted(MOST_RECENT_FIRST)
                .limit(limit)
                .map(ExecutionSnapshot::toState)
                .collect(Collectors.toList());
    }

    public void clear() {
        snapshots.clear();
    }
}
