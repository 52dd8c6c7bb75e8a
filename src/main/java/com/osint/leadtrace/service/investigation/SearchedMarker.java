package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.exception.GraphStoreException;
import com.osint.leadtrace.model.graph.EmbeddedEdge;
import com.osint.leadtrace.model.graph.GraphNode;
import com.osint.leadtrace.service.graph.GraphStore;
import com.osint.leadtrace.service.graph.IdentityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Sets {@code already_searched} on the VERIFIED edges pointing at an entity once it
 * has been searched, so the next queue build does not hand it out again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchedMarker {

    private final GraphStore graphStore;

    /**
     * Best-effort.
     *
     * @return number of edges marked, or -1 when the store failed
     */
    public int markSearched(String projectId, String entityValue, IdentityRegistry registry) {
        try {
            String entityId = registry.nodeIdFor(entityValue).orElse(null);
            if (entityId == null) {
                Optional<GraphNode> entity = graphStore.getNodeByCanonicalValue(projectId, entityValue);
                if (entity.isEmpty()) {
                    log.debug("No node for {} yet, nothing to mark", entityValue);
                    return 0;
                }
                entityId = entity.get().getId();
                registry.register(entityValue, entityId);
            }

            int marked = 0;
            List<GraphNode> nodes = graphStore.queryNodesWithEdges(projectId);
            for (GraphNode node : nodes) {
                boolean changed = false;
                for (EmbeddedEdge edge : node.getEmbeddedEdges()) {
                    if (edge.isVerified() && !edge.isAlreadySearched() && entityId.equals(edge.getTargetId())) {
                        edge.setAlreadySearched(true);
                        changed = true;
                        marked++;
                    }
                }
                if (changed) {
                    graphStore.updateNode(node.getId(), node.getEmbeddedEdges());
                }
            }
            return marked;

        } catch (GraphStoreException e) {
            log.error("Failed to mark {} as searched: {}", entityValue, e.getMessage(), e);
            return -1;
        }
    }
}
