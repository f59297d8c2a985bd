package io.docflow.core.state;

import io.docflow.core.util.RawMaps;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// One entry of an execution's append-only node history.
///
/// @param nodeId executed node, not null
/// @param outcome reported outcome, not null
/// @param timestamp when the entry was recorded, not null
/// @param metadata executor metadata, never null
public record NodeExecution(
        String nodeId, String outcome, Instant timestamp, Map<String, Object> metadata) {

    public NodeExecution {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = RawMaps.freezeMap(metadata);
    }
}
