package io.docflow.core.exception;

import java.io.Serial;

/// Thrown after a node executor raised unexpectedly; the execution is already persisted as failed.
public final class NodeExecutionException extends DocflowException {

    @Serial private static final long serialVersionUID = 7L;

    private final String executionId;
    private final String nodeId;

    public NodeExecutionException(String executionId, String nodeId, Throwable cause) {
        super("Node '" + nodeId + "' failed in execution " + executionId + ": " + cause.getMessage(), cause);
        this.executionId = executionId;
        this.nodeId = nodeId;
    }

    public NodeExecutionException(String executionId, String nodeId, String message) {
        super("Node '" + nodeId + "' failed in execution " + executionId + ": " + message);
        this.executionId = executionId;
        this.nodeId = nodeId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getNodeId() {
        return nodeId;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NODE_EXECUTION;
    }
}
