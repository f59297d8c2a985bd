package io.docflow.core.orchestration;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Outcome of a full-line orchestration run.
///
/// @param orchestrationId generated run identifier, not null
/// @param subjectId subject whose documents were produced, not null
/// @param status overall status, not null
/// @param tracks final track states keyed by document type, in graph order
/// @param iterations orchestration loop iterations used
/// @param startedAt run start
/// @param completedAt run end
public record OrchestrationResult(
        String orchestrationId,
        String subjectId,
        OrchestrationStatus status,
        Map<String, DocumentTrack> tracks,
        int iterations,
        Instant startedAt,
        Instant completedAt) {

    public OrchestrationResult {
        tracks = Collections.unmodifiableMap(new LinkedHashMap<>(tracks));
    }

    public Optional<DocumentTrack> track(String documentType) {
        return Optional.ofNullable(tracks.get(documentType));
    }
}
