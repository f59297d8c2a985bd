package io.docflow.core.state;

import java.util.List;
import java.util.Optional;

/// Persistence contract for execution state.
///
/// `save` is an upsert by execution id and is the single serialization point for
/// an execution; the engine does no locking or versioning of its own.
///
/// ### Contracts
/// - Implementations must return copies: mutating a loaded state never affects the
///   stored one until it is saved again
/// - Implementations must be thread-safe across different execution ids
///
/// @see InMemoryExecutionStateRepository
public interface ExecutionStateRepository {

    /// Inserts or replaces the state with the same execution id.
    void save(ExecutionState state);

    Optional<ExecutionState> findByExecutionId(String executionId);

    /// Finds a non-terminal execution of a workflow for a subject, for resumption.
    ///
    /// @param subjectId project or document identifier, not null
    /// @param workflowId workflow id, not null
    /// @return the most recent non-terminal execution, or empty
    Optional<ExecutionState> findActiveBySubject(String subjectId, String workflowId);

    /// Lists executions, most recently created first.
    ///
    /// @param statusFilter status to filter on, null for all
    /// @param limit maximum number of results, positive
    /// @return executions, never null
    List<ExecutionState> list(ExecutionStatus statusFilter, int limit);
}
