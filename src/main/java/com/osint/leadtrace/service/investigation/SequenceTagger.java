package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.exception.GraphStoreException;
import com.osint.leadtrace.model.graph.EmbeddedEdge;
import com.osint.leadtrace.model.graph.GraphNode;
import com.osint.leadtrace.service.graph.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Maintains the per-chain iteration counter ({@code <chainKey>_<n>}) carried by
 * UNVERIFIED edges.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SequenceTagger {

    private static final String FIRST_SUFFIX = "_1";

    private final GraphStore graphStore;

    /**
     * Next tag in the chain. A missing or malformed tag restarts the chain at
     * {@code entityValue_1}.
     * Examples:
     * - ("bob", "alice@x.com_1") -> "alice@x.com_2"
     * - ("bob", "") -> "bob_1"
     * - ("bob", "no-underscore") -> "bob_1"
     * - ("bob", "chain_x") -> "bob_1"
     * - ("bob", "_3") -> "_4"
     */
    public String increment(String entityValue, String currentTag) {
        if (currentTag == null || currentTag.isBlank() || currentTag.indexOf('_') < 0) {
            return entityValue + FIRST_SUFFIX;
        }

        int split = currentTag.lastIndexOf('_');
        String base = currentTag.substring(0, split);
        String counter = currentTag.substring(split + 1);

        try {
            BigInteger n = new BigInteger(counter);
            if (n.signum() < 1) {
                log.debug("Tag '{}' has non-positive counter {}, resetting", currentTag, n);
                return entityValue + FIRST_SUFFIX;
            }
            return base + "_" + n.add(BigInteger.ONE);
        } catch (NumberFormatException e) {
            log.debug("Tag '{}' has a non-numeric counter, resetting", currentTag);
            return entityValue + FIRST_SUFFIX;
        }
    }

    /**
     * Move every edge of the project tagged {@code oldTag} to {@code newTag} and mark it searched.
     *
     * Best-effort and not transactional: nodes are persisted one at a time and a
     * failure part-way leaves the earlier nodes updated.
     *
     * @return true when every affected node was persisted (including when none matched)
     */
    public boolean applyTag(String projectId, String entityValue, String oldTag, String newTag) {
        if (oldTag == null || oldTag.isBlank()) {
            log.debug("No previous tag for {}, nothing to move", entityValue);
            return true;
        }

        List<GraphNode> nodes;
        try {
            nodes = graphStore.queryNodesWithEdges(projectId);
        } catch (GraphStoreException e) {
            log.error("Failed to load edges tagged {} for {}: {}", oldTag, entityValue, e.getMessage(), e);
            return false;
        }

        int nodesUpdated = 0;
        int edgesUpdated = 0;
        int nodesFailed = 0;

        for (GraphNode node : nodes) {
            boolean changed = false;
            for (EmbeddedEdge edge : node.getEmbeddedEdges()) {
                if (oldTag.equals(edge.getQuerySequenceTag())) {
                    edge.setQuerySequenceTag(newTag);
                    edge.setAlreadySearched(true);
                    edgesUpdated++;
                    changed = true;
                }
            }
            if (!changed) {
                continue;
            }

            try {
                if (graphStore.updateNode(node.getId(), node.getEmbeddedEdges())) {
                    nodesUpdated++;
                } else {
                    nodesFailed++;
                    log.warn("Node {} vanished while moving tag {} -> {}", node.getId(), oldTag, newTag);
                }
            } catch (GraphStoreException e) {
                nodesFailed++;
                log.error("Failed to persist tag {} -> {} on node {}: {}", oldTag, newTag, node.getId(), e.getMessage());
            }
        }

        if (nodesFailed > 0) {
            log.warn("Partially moved tag {} -> {}: {} node(s) updated, {} failed", oldTag, newTag, nodesUpdated, nodesFailed);
            return false;
        }
        log.info("Updated tags: {} -> {} ({} edge(s) on {} node(s))", oldTag, newTag, edgesUpdated, nodesUpdated);
        return true;
    }
}
