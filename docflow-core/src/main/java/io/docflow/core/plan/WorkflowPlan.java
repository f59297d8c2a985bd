package io.docflow.core.plan;

import io.docflow.core.plan.edge.Edge;
import io.docflow.core.plan.governance.Governance;
import io.docflow.core.plan.node.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable, validated workflow plan for one document type.
///
/// A plan is a directed graph of {@link Node}s joined by {@link Edge}s. Edges are
/// kept in declaration order, which is the router's tie-break order. Lookups by
/// node id and by source node are indexed at construction.
///
/// ### Contracts
/// - **Precondition**: `workflowId` and at least one entry node are set; `documentType`
///   defaults to the workflow id
/// - **Postcondition**: node ids are unique; edges from a node preserve declaration order
///
/// @implNote Immutable after construction and safe to share across threads.
///
/// @see PlanLoader for building plans from validated definitions
/// @see io.docflow.core.routing.EdgeRouter for traversal
public final class WorkflowPlan {

    public static final String DEFAULT_VERSION = "1.0.0";

    private final String workflowId;
    private final String version;
    private final String name;
    private final String description;
    private final String scopeType;
    private final String documentType;
    private final List<String> entryNodeIds;
    private final Map<String, Node> nodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> edgesBySource;
    private final List<OutcomeMappingEntry> outcomeMapping;
    private final ThreadOwnership threadOwnership;
    private final Governance governance;
    private final Map<String, Object> metadata;

    private WorkflowPlan(Builder builder) {
        this.workflowId = Objects.requireNonNull(builder.workflowId, "workflowId");
        this.documentType = builder.documentType != null ? builder.documentType : workflowId;
        if (builder.entryNodeIds.isEmpty()) {
            throw new IllegalStateException("Plan " + workflowId + " declares no entry nodes");
        }
        this.version = builder.version != null ? builder.version : DEFAULT_VERSION;
        this.name = builder.name;
        this.description = builder.description;
        this.scopeType = builder.scopeType;
        this.entryNodeIds = List.copyOf(builder.entryNodeIds);
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.edges = List.copyOf(builder.edges);
        this.outcomeMapping = List.copyOf(builder.outcomeMapping);
        this.threadOwnership =
                builder.threadOwnership != null ? builder.threadOwnership : ThreadOwnership.NONE;
        this.governance = builder.governance != null ? builder.governance : Governance.NONE;
        this.metadata = Collections.unmodifiableMap(new HashMap<>(builder.metadata));

        Map<String, List<Edge>> index = new HashMap<>();
        for (Edge edge : edges) {
            index.computeIfAbsent(edge.fromNodeId(), k -> new ArrayList<>()).add(edge);
        }
        Map<String, List<Edge>> frozen = new HashMap<>();
        index.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.edgesBySource = Collections.unmodifiableMap(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getVersion() {
        return version;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getScopeType() {
        return scopeType;
    }

    public String getDocumentType() {
        return documentType;
    }

    /// Returns entry node ids in declaration order; the first one is the primary entry.
    ///
    /// @return unmodifiable non-empty list, never null
    public List<String> getEntryNodeIds() {
        return entryNodeIds;
    }

    public String getPrimaryEntryNodeId() {
        return entryNodeIds.get(0);
    }

    /// Returns all nodes keyed by id in declaration order.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Node> getNodes() {
        return nodes;
    }

    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /// Returns all edges in declaration order.
    ///
    /// @return unmodifiable list, never null
    public List<Edge> getEdges() {
        return edges;
    }

    /// Returns the outbound edges of a node in declaration order.
    ///
    /// @param nodeId source node id, may be null
    /// @return unmodifiable list, empty when the node has no outbound edges, never null
    public List<Edge> getEdgesFrom(String nodeId) {
        return edgesBySource.getOrDefault(nodeId, List.of());
    }

    public List<OutcomeMappingEntry> getOutcomeMapping() {
        return outcomeMapping;
    }

    public ThreadOwnership getThreadOwnership() {
        return threadOwnership;
    }

    public Governance getGovernance() {
        return governance;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "WorkflowPlan{" + workflowId + "@" + version + ", documentType=" + documentType + "}";
    }

    public static final class Builder {
        private String workflowId;
        private String version;
        private String name;
        private String description;
        private String scopeType;
        private String documentType;
        private final List<String> entryNodeIds = new ArrayList<>();
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final List<OutcomeMappingEntry> outcomeMapping = new ArrayList<>();
        private ThreadOwnership threadOwnership;
        private Governance governance;
        private final Map<String, Object> metadata = new HashMap<>();

        private Builder() {}

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder scopeType(String scopeType) {
            this.scopeType = scopeType;
            return this;
        }

        public Builder documentType(String documentType) {
            this.documentType = documentType;
            return this;
        }

        public Builder entryNodeIds(List<String> entryNodeIds) {
            this.entryNodeIds.clear();
            this.entryNodeIds.addAll(entryNodeIds);
            return this;
        }

        public Builder entryNode(String nodeId) {
            this.entryNodeIds.add(nodeId);
            return this;
        }

        /// Adds a node.
        ///
        /// @throws IllegalArgumentException if a node with the same id was already added
        public Builder node(Node node) {
            if (nodes.putIfAbsent(node.getNodeId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.getNodeId());
            }
            return this;
        }

        public Builder edge(Edge edge) {
            this.edges.add(edge);
            return this;
        }

        public Builder mapOutcome(String gateOutcome, String terminalOutcome) {
            this.outcomeMapping.add(new OutcomeMappingEntry(gateOutcome, terminalOutcome));
            return this;
        }

        public Builder threadOwnership(ThreadOwnership threadOwnership) {
            this.threadOwnership = threadOwnership;
            return this;
        }

        public Builder governance(Governance governance) {
            this.governance = governance;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public WorkflowPlan build() {
            return new WorkflowPlan(this);
        }
    }
}
