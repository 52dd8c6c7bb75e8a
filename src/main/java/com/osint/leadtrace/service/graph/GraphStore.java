package com.osint.leadtrace.service.graph;

import com.osint.leadtrace.exception.GraphStoreException;
import com.osint.leadtrace.model.graph.EmbeddedEdge;
import com.osint.leadtrace.model.graph.GraphNode;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Narrow document read/update interface the investigation scheduler runs against.
 * Every operation signals failure with {@link GraphStoreException}.
 */
public interface GraphStore {

    /**
     * All nodes of the project that hold at least one embedded edge.
     */
    List<GraphNode> queryNodesWithEdges(String projectId);

    /**
     * Evidence nodes of the project with an edge whose target id is {@code targetId}.
     */
    List<GraphNode> queryEvidenceNodesReferencing(String projectId, String targetId);

    Optional<GraphNode> getNodeByCanonicalValue(String projectId, String canonicalValue);

    List<GraphNode> findNodesByIds(String projectId, Collection<String> nodeIds);

    /**
     * Replace the node's embedded edges and stamp {@code updatedAt}.
     *
     * @return true when the node was found and updated
     */
    boolean updateNode(String nodeId, List<EmbeddedEdge> edges);
}
