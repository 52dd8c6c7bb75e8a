package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.exception.GraphStoreException;
import com.osint.leadtrace.model.graph.EmbeddedEdge;
import com.osint.leadtrace.model.graph.GraphNode;
import com.osint.leadtrace.model.graph.VerificationStatus;
import com.osint.leadtrace.service.graph.GraphStore;
import com.osint.leadtrace.service.graph.IdentityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Flips every matching UNVERIFIED edge of an entity to VERIFIED.
 *
 * A promoted edge loses its sequence tag and is marked not yet searched, so the
 * entity becomes eligible for the VERIFIED queue straight away.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromotionApplier {

    static final String MATCH_METADATA_KEY = "upgrade_match";

    private final GraphStore graphStore;

    public PromotionResult apply(String entityValue, String projectId, String reason) {
        return apply(entityValue, projectId, reason, new IdentityRegistry());
    }

    public PromotionResult apply(String entityValue, String projectId, String reason, IdentityRegistry registry) {
        try {
            String entityId = resolveEntityId(entityValue, projectId, registry);
            if (entityId == null) {
                log.warn("Promoting {} without a node id; only tag-addressed edges can match", entityValue);
            }

            List<GraphNode> nodes = graphStore.queryNodesWithEdges(projectId);
            LocalDateTime now = LocalDateTime.now();

            int edgesUpdated = 0;
            int nodesUpdated = 0;
            int exact = 0;
            int bySubstring = 0;

            for (GraphNode node : nodes) {
                int nodeExact = 0;
                int nodeBySubstring = 0;
                for (EmbeddedEdge edge : node.getEmbeddedEdges()) {
                    if (!edge.isUnverified()) {
                        continue;
                    }
                    Optional<EdgeMatch> match = EdgeMatch.classify(edge, entityId, entityValue);
                    if (match.isEmpty()) {
                        continue;
                    }

                    edge.setVerificationStatus(VerificationStatus.VERIFIED);
                    edge.setQuerySequenceTag(null);
                    edge.setAlreadySearched(false);
                    edge.setUpgradeReason(reason);
                    edge.setUpgradedAt(now);
                    edge.putMetadata(MATCH_METADATA_KEY, match.get().name());
                    if (match.get() == EdgeMatch.EXACT_ID) {
                        nodeExact++;
                    } else {
                        nodeBySubstring++;
                    }
                }

                if (nodeExact + nodeBySubstring == 0) {
                    continue;
                }
                // only persisted edges count
                if (graphStore.updateNode(node.getId(), node.getEmbeddedEdges())) {
                    nodesUpdated++;
                    edgesUpdated += nodeExact + nodeBySubstring;
                    exact += nodeExact;
                    bySubstring += nodeBySubstring;
                } else {
                    log.warn("Node {} vanished before its promoted edges for {} were saved", node.getId(), entityValue);
                }
            }

            log.info("VERIFICATION UPGRADE: {} ({}) - {} edge(s) on {} node(s) UNVERIFIED -> VERIFIED [exact={}, tag={}]",
                    entityValue, reason, edgesUpdated, nodesUpdated, exact, bySubstring);
            return new PromotionResult(true, edgesUpdated, nodesUpdated, exact, bySubstring);

        } catch (GraphStoreException e) {
            log.error("Error upgrading {} to VERIFIED: {}", entityValue, e.getMessage(), e);
            return PromotionResult.failed();
        }
    }

    private String resolveEntityId(String entityValue, String projectId, IdentityRegistry registry) {
        Optional<String> known = registry.nodeIdFor(entityValue);
        if (known.isPresent()) {
            return known.get();
        }
        Optional<GraphNode> node = graphStore.getNodeByCanonicalValue(projectId, entityValue);
        node.ifPresent(n -> registry.register(entityValue, n.getId()));
        return node.map(GraphNode::getId).orElse(null);
    }
}
