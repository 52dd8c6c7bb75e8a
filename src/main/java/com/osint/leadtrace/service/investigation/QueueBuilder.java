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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scans the project graph and partitions outstanding work into the VERIFIED and
 * UNVERIFIED queues. Read-only.
 *
 * UNVERIFIED edges are admitted only while their tag still ends in {@code _1};
 * chains already advanced past the first iteration are not re-queued here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueueBuilder {

    private static final String FIRST_ITERATION_SUFFIX = "_1";

    private final GraphStore graphStore;

    public PriorityQueues build(String projectId) {
        return build(projectId, new IdentityRegistry());
    }

    /**
     * Never throws: a store failure yields two empty queues.
     */
    public PriorityQueues build(String projectId, IdentityRegistry registry) {
        try {
            List<GraphNode> nodes = graphStore.queryNodesWithEdges(projectId);
            for (GraphNode node : nodes) {
                registry.register(node.getCanonicalValue(), node.getId());
            }
            resolveTargets(projectId, nodes, registry);

            Set<String> verified = new LinkedHashSet<>();
            Map<String, String> unverified = new LinkedHashMap<>();

            for (GraphNode node : nodes) {
                for (EmbeddedEdge edge : node.getEmbeddedEdges()) {
                    if (!isQueueable(edge)) {
                        continue;
                    }
                    Optional<String> targetValue = registry.valueFor(edge.getTargetId());
                    if (targetValue.isEmpty()) {
                        log.warn("Skipping edge {} -> {}: target has no canonical value", node.getId(), edge.getTargetId());
                        continue;
                    }
                    if (edge.isVerified()) {
                        verified.add(targetValue.get());
                    } else {
                        unverified.putIfAbsent(targetValue.get(), edge.getQuerySequenceTag());
                    }
                }
            }

            List<UnverifiedLead> unverifiedQueue = new ArrayList<>();
            unverified.forEach((value, tag) -> unverifiedQueue.add(new UnverifiedLead(value, tag)));

            log.info("Priority queues built for project {}: {} VERIFIED, {} UNVERIFIED",
                    projectId, verified.size(), unverifiedQueue.size());
            return new PriorityQueues(new ArrayList<>(verified), unverifiedQueue);

        } catch (GraphStoreException e) {
            log.error("Error building priority queues for project {}: {}", projectId, e.getMessage(), e);
            return PriorityQueues.empty();
        }
    }

    static boolean isQueueable(EmbeddedEdge edge) {
        if (edge.isVerified()) {
            return !edge.isAlreadySearched();
        }
        if (edge.isUnverified()) {
            String tag = edge.getQuerySequenceTag();
            return tag != null && tag.endsWith(FIRST_ITERATION_SUFFIX);
        }
        return false;
    }

    // Targets that hold no edges of their own are not in the scan; load them in one batch
    private void resolveTargets(String projectId, List<GraphNode> nodes, IdentityRegistry registry) {
        Set<String> missing = new LinkedHashSet<>();
        for (GraphNode node : nodes) {
            for (EmbeddedEdge edge : node.getEmbeddedEdges()) {
                if (edge.getTargetId() != null && isQueueable(edge) && registry.valueFor(edge.getTargetId()).isEmpty()) {
                    missing.add(edge.getTargetId());
                }
            }
        }
        if (missing.isEmpty()) {
            return;
        }
        for (GraphNode target : graphStore.findNodesByIds(projectId, missing)) {
            registry.register(target.getCanonicalValue(), target.getId());
        }
    }
}
