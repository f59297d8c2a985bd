package io.docflow.core.orchestration;

import io.docflow.core.DocflowConfig;
import io.docflow.core.exception.DocflowException;
import io.docflow.core.exception.ExecutionNotFoundException;
import io.docflow.core.execution.ExecutionStatusView;
import io.docflow.core.execution.PlanExecutor;
import io.docflow.core.state.ExecutionState;
import io.docflow.core.state.ExecutionStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Produces every document of a subject in dependency order.
///
/// Each document type is a track. Tracks whose dependencies are all stabilized start
/// concurrently on the shared executor service and run until they complete, fail or
/// pause. Completed tracks unblock their dependents; the loop repeats until no track
/// is ready or the iteration limit is reached.
///
/// ### Track transitions
/// | Execution result | Track state           |
/// |------------------|-----------------------|
/// | completed        | `STABILIZED`          |
/// | paused           | `AWAITING_OPERATOR`   |
/// | failed or error  | `HALTED`              |
///
/// ### Contracts
/// - A track never starts before all of its dependencies are `STABILIZED`
/// - A halted or paused dependency keeps its dependents `BLOCKED`
/// - Starting a track for a subject that already has an active execution reuses it
///
/// @implNote One orchestration run uses one thread for the loop plus up to
/// `orchestratorThreads` pooled threads for tracks. Tracks of one run never share an
/// execution, so concurrent stepping never targets the same state.
///
/// @see PlanExecutor#runToCompletionOrPause(String)
public class ProjectOrchestrator {

    private static final Logger logger = Logger.getLogger(ProjectOrchestrator.class.getName());

    private final PlanExecutor planExecutor;
    private final ExecutorService executorService;
    private final int maxIterations;
    private final Duration pollInterval;
    private final int maxPollAttempts;

    public ProjectOrchestrator(
            PlanExecutor planExecutor, ExecutorService executorService, DocflowConfig config) {
        this.planExecutor = Objects.requireNonNull(planExecutor, "planExecutor must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.maxIterations = config.getMaxOrchestrationIterations();
        this.pollInterval = config.getPollInterval();
        this.maxPollAttempts = config.getMaxPollAttempts();
    }

    /// Runs production for all document types of a subject.
    ///
    /// @param subjectId subject to produce documents for, not null
    /// @param dependencies document type to the document types it requires, not null
    /// @param alreadyStabilized document types that need no production, not null
    /// @return final orchestration state, never null
    /// @throws InterruptedException if interrupted while waiting on tracks
    public OrchestrationResult runFullLine(
            String subjectId, Map<String, List<String>> dependencies, Set<String> alreadyStabilized)
            throws InterruptedException {
        String orchestrationId = "orch-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        Instant startedAt = Instant.now();
        logger.info(
                "Starting orchestration "
                        + orchestrationId
                        + " for subject "
                        + subjectId
                        + " ("
                        + dependencies.size()
                        + " document types)");

        Map<String, DocumentTrack> tracks = new LinkedHashMap<>();
        dependencies.forEach(
                (documentType, requires) -> {
                    if (alreadyStabilized.contains(documentType)) {
                        tracks.put(documentType, DocumentTrack.stabilized(documentType));
                    } else {
                        List<String> missing =
                                requires.stream()
                                        .filter(dep -> !alreadyStabilized.contains(dep))
                                        .collect(Collectors.toList());
                        tracks.put(documentType, DocumentTrack.pending(documentType, missing));
                    }
                });

        int iteration = 0;
        boolean idle = false;
        while (iteration < maxIterations) {
            iteration++;
            List<String> ready = findReady(tracks);
            if (ready.isEmpty()) {
                idle = true;
                break;
            }
            logger.info("Orchestration " + orchestrationId + " starting tracks " + ready);
            runTracks(subjectId, ready, tracks);
            Set<String> stabilized = stabilizedTypes(tracks);
            tracks.replaceAll((type, track) -> track.unblock(stabilized));
        }
        if (!idle) {
            logger.warning(
                    "Orchestration " + orchestrationId + " hit iteration limit (" + maxIterations + ")");
        }

        OrchestrationStatus status = finalStatus(tracks);
        logger.info("Orchestration " + orchestrationId + " finished: " + status);
        return new OrchestrationResult(
                orchestrationId, subjectId, status, tracks, iteration, startedAt, Instant.now());
    }

    /// Polls an execution until it is no longer paused.
    ///
    /// Sleeps `pollInterval` between polls, at most `maxPollAttempts` times.
    ///
    /// @param executionId execution to watch, not null
    /// @return the last observed status, paused if the attempts ran out
    /// @throws ExecutionNotFoundException if the execution does not exist
    /// @throws InterruptedException if interrupted while sleeping
    public ExecutionStatusView awaitInputResolution(String executionId)
            throws ExecutionNotFoundException, InterruptedException {
        ExecutionStatusView view = planExecutor.getExecutionStatus(executionId);
        int attempts = 0;
        while (view.status() == ExecutionStatus.PAUSED
                && attempts < maxPollAttempts) {
            Thread.sleep(pollInterval.toMillis());
            attempts++;
            view = planExecutor.getExecutionStatus(executionId);
        }
        if (view.status() == ExecutionStatus.PAUSED) {
            logger.info(
                    "Execution " + executionId + " still paused after " + attempts + " poll attempts");
        }
        return view;
    }

    private void runTracks(String subjectId, List<String> ready, Map<String, DocumentTrack> tracks)
            throws InterruptedException {
        List<Future<DocumentTrack>> futures = new ArrayList<>();
        for (String documentType : ready) {
            DocumentTrack track = tracks.get(documentType);
            futures.add(executorService.submit(() -> produce(subjectId, track)));
        }
        for (int i = 0; i < futures.size(); i++) {
            String documentType = ready.get(i);
            try {
                tracks.put(documentType, futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warning("Track " + documentType + " errored: " + cause.getMessage());
                tracks.put(documentType, tracks.get(documentType).halted(cause.getMessage()));
            }
        }
    }

    /// Starts (or reuses) the execution of one track and runs it until it stops.
    private DocumentTrack produce(String subjectId, DocumentTrack track) {
        DocumentTrack current = track;
        try {
            ExecutionState started =
                    planExecutor.startExecution(subjectId, track.documentType(), Map.of());
            current = track.started(started.getExecutionId());
            ExecutionState state = planExecutor.runToCompletionOrPause(started.getExecutionId());
            return switch (state.getStatus()) {
                case COMPLETED -> {
                    logger.info(track.documentType() + " stabilized");
                    yield current.withState(TrackState.STABILIZED);
                }
                case PAUSED -> {
                    logger.info(track.documentType() + " awaiting operator");
                    yield current.withState(TrackState.AWAITING_OPERATOR);
                }
                case FAILED -> {
                    String reason = state.lastFailureReason().orElse("failed");
                    logger.info(track.documentType() + " halted: " + reason);
                    yield current.halted(reason);
                }
                case PENDING, RUNNING -> current;
            };
        } catch (DocflowException e) {
            logger.warning("Track " + track.documentType() + " halted: " + e.getMessage());
            return current.halted(e.getMessage());
        }
    }

    private static List<String> findReady(Map<String, DocumentTrack> tracks) {
        Set<String> stabilized = stabilizedTypes(tracks);
        return tracks.values().stream()
                .filter(track -> track.state() == TrackState.QUEUED)
                .filter(track -> stabilized.containsAll(track.blockedBy()))
                .map(DocumentTrack::documentType)
                .collect(Collectors.toList());
    }

    private static Set<String> stabilizedTypes(Map<String, DocumentTrack> tracks) {
        return tracks.values().stream()
                .filter(track -> track.state() == TrackState.STABILIZED)
                .map(DocumentTrack::documentType)
                .collect(Collectors.toSet());
    }

    static OrchestrationStatus finalStatus(Map<String, DocumentTrack> tracks) {
        boolean halted = false;
        boolean awaiting = false;
        boolean settled = true;
        for (DocumentTrack track : tracks.values()) {
            halted |= track.state() == TrackState.HALTED;
            awaiting |= track.state() == TrackState.AWAITING_OPERATOR;
            settled &= track.state().isSettled();
        }
        if (awaiting) {
            return OrchestrationStatus.PAUSED;
        }
        if (halted) {
            return OrchestrationStatus.HALTED;
        }
        return settled ? OrchestrationStatus.COMPLETED : OrchestrationStatus.RUNNING;
    }
}
