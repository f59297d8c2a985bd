package io.docflow.core.exception;

import java.io.Serial;

/// Routing dead-end: no edge matches the reported outcome of a node.
public final class NoMatchingEdgeException extends DocflowException {

    @Serial private static final long serialVersionUID = 6L;

    private final String nodeId;
    private final String outcome;

    public NoMatchingEdgeException(String nodeId, String outcome) {
        super("No edge from node '" + nodeId + "' matches outcome '" + outcome + "'");
        this.nodeId = nodeId;
        this.outcome = outcome;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getOutcome() {
        return outcome;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NO_MATCHING_EDGE;
    }
}
