package io.docflow.core.orchestration;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Immutable view of one document type's production within an orchestration.
///
/// @param documentType document type produced by this track, not null
/// @param state current production state, not null
/// @param executionId execution driving the track, null until started
/// @param blockedBy dependencies not yet stabilized, never null
/// @param error failure description when halted, may be null
/// @param startedAt when the execution was started, may be null
/// @param completedAt when the track stabilized, may be null
public record DocumentTrack(
        String documentType,
        TrackState state,
        String executionId,
        List<String> blockedBy,
        String error,
        Instant startedAt,
        Instant completedAt) {

    public DocumentTrack {
        Objects.requireNonNull(documentType, "documentType must not be null");
        Objects.requireNonNull(state, "state must not be null");
        blockedBy = blockedBy != null ? List.copyOf(blockedBy) : List.of();
    }

    /// Creates a track that is queued when `blockedBy` is empty and blocked otherwise.
    public static DocumentTrack pending(String documentType, List<String> blockedBy) {
        TrackState state = blockedBy.isEmpty() ? TrackState.QUEUED : TrackState.BLOCKED;
        return new DocumentTrack(documentType, state, null, blockedBy, null, null, null);
    }

    public static DocumentTrack stabilized(String documentType) {
        return new DocumentTrack(
                documentType, TrackState.STABILIZED, null, List.of(), null, null, Instant.now());
    }

    public DocumentTrack started(String executionId) {
        return new DocumentTrack(
                documentType, TrackState.RUNNING, executionId, List.of(), null, Instant.now(), null);
    }

    public DocumentTrack withState(TrackState newState) {
        Instant completed = newState == TrackState.STABILIZED ? Instant.now() : completedAt;
        return new DocumentTrack(
                documentType, newState, executionId, blockedBy, error, startedAt, completed);
    }

    public DocumentTrack halted(String reason) {
        return new DocumentTrack(
                documentType, TrackState.HALTED, executionId, blockedBy, reason, startedAt, null);
    }

    /// Removes stabilized dependencies, queueing the track once none remain.
    public DocumentTrack unblock(Set<String> stabilized) {
        if (state != TrackState.BLOCKED) {
            return this;
        }
        List<String> remaining =
                blockedBy.stream().filter(dep -> !stabilized.contains(dep)).toList();
        TrackState next = remaining.isEmpty() ? TrackState.QUEUED : TrackState.BLOCKED;
        return new DocumentTrack(documentType, next, executionId, remaining, error, startedAt, completedAt);
    }
}
