package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.exception.GraphStoreException;
import com.osint.leadtrace.model.graph.EmbeddedEdge;
import com.osint.leadtrace.model.graph.GraphNode;
import com.osint.leadtrace.service.graph.GraphStore;
import com.osint.leadtrace.service.graph.IdentityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether an UNVERIFIED entity has earned promotion.
 *
 * One hop only: the entity is corroborated by each evidence node that references it
 * and is either VERIFIED itself or also references a VERIFIED sibling. The scan of an
 * evidence node stops at its first VERIFIED sibling.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VerificationEvaluator {

    private final GraphStore graphStore;

    public VerificationDecision check(String entityValue, String projectId) {
        return check(entityValue, projectId, new IdentityRegistry());
    }

    /**
     * Never throws; a store failure is reported as {@code error:<message>}.
     */
    public VerificationDecision check(String entityValue, String projectId, IdentityRegistry registry) {
        try {
            Optional<GraphNode> entity = graphStore.getNodeByCanonicalValue(projectId, entityValue);
            if (entity.isEmpty()) {
                return VerificationDecision.rejected(VerificationDecision.ENTITY_NOT_FOUND);
            }
            String entityId = entity.get().getId();
            registry.register(entityValue, entityId);

            List<String> evidence = new ArrayList<>();
            for (GraphNode source : graphStore.queryEvidenceNodesReferencing(projectId, entityId)) {
                if (source.isVerified()) {
                    evidence.add("same_breach_record:" + source.getId());
                    continue;
                }
                for (EmbeddedEdge edge : source.getEmbeddedEdges()) {
                    if (entityId.equals(edge.getTargetId())) {
                        continue;
                    }
                    if (edge.isVerified()) {
                        evidence.add("cooccurs_with_verified:" + edge.getTargetId());
                        break;
                    }
                }
            }

            if (!evidence.isEmpty()) {
                String reason = "found_with_verified_entities:" + evidence.size() + "x";
                log.debug("{} corroborated by {}", entityValue, evidence);
                return new VerificationDecision(true, reason, evidence);
            }
            return VerificationDecision.rejected(VerificationDecision.NO_VERIFIED_CONNECTIONS);

        } catch (GraphStoreException e) {
            log.error("Error checking verification upgrade for {}: {}", entityValue, e.getMessage(), e);
            return VerificationDecision.rejected("error:" + e.getMessage());
        }
    }
}
