package com.osint.leadtrace.service.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.osint.leadtrace.dto.lookup.DiscoveredEntity;
import com.osint.leadtrace.dto.lookup.LookupResponse;
import com.osint.leadtrace.model.graph.EmbeddedEdge;
import com.osint.leadtrace.model.graph.GraphNode;
import com.osint.leadtrace.model.graph.NodeClass;
import com.osint.leadtrace.model.graph.VerificationStatus;
import com.osint.leadtrace.repository.graph.GraphNodeRepository;
import com.osint.leadtrace.service.search.CanonicalValueNormalizer;
import com.osint.leadtrace.service.search.QueryType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Writes one lookup result into the project graph.
 *
 * Flow:
 * 1. Upsert the searched entity and stamp it as searched
 * 2. Upsert every discovered entity (by canonical value)
 * 3. Create one evidence node holding an edge to each discovered entity
 * 4. Link the searched entity to the evidence node
 *
 * The evidence node and its edges take the confidence of the search: VERIFIED when
 * the search was ON a unique identifier, UNVERIFIED (with a fresh {@code <value>_1}
 * tag) otherwise.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceIngestor {

    static final String LAST_SEARCHED_KEY = "last_searched_at";
    static final String PROVENANCE_RELATION = "produced";
    private static final int MIN_ENTITY_LENGTH = 3;
    private static final int MAX_COMMENT_LENGTH = 20000;

    private final GraphNodeRepository graphNodeRepository;
    private final CanonicalValueNormalizer normalizer;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public IngestionResult ingest(String projectId, String searchedValue, QueryType searchedType,
                                  LookupResponse response, IdentityRegistry registry) {
        LocalDateTime now = LocalDateTime.now();
        String source = response.getSource() != null ? response.getSource() : "unknown";
        VerificationStatus status = searchedType.isVerifying() ? VerificationStatus.VERIFIED : VerificationStatus.UNVERIFIED;

        String searchedCanonical = normalizer.normalize(searchedType, searchedValue);
        GraphNode searchedNode = graphNodeRepository.findFirstByProjectIdAndCanonicalValue(projectId, searchedCanonical)
                .orElseGet(() -> newEntityNode(projectId, searchedType, searchedCanonical, searchedValue, now));

        List<EmbeddedEdge> evidenceEdges = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int created = 0;
        int skipped = 0;

        List<DiscoveredEntity> entities = response.getEntities() != null ? response.getEntities() : List.of();
        for (DiscoveredEntity discovered : entities) {
            Optional<QueryType> type = QueryType.fromEntityType(discovered.getType());
            String rawValue = discovered.getValue() != null ? discovered.getValue().trim() : "";
            if (type.isEmpty() || rawValue.length() < MIN_ENTITY_LENGTH) {
                skipped++;
                continue;
            }
            String canonical = normalizer.normalize(type.get(), rawValue);
            if (canonical.isEmpty() || canonical.equals(searchedCanonical) || !seen.add(canonical)) {
                skipped++;
                continue;
            }

            Optional<GraphNode> existing = graphNodeRepository.findFirstByProjectIdAndCanonicalValue(projectId, canonical);
            GraphNode target = existing.orElseGet(() ->
                    graphNodeRepository.save(newEntityNode(projectId, type.get(), canonical, rawValue, now)));
            if (existing.isEmpty()) {
                created++;
            }
            registry.register(canonical, target.getId());
            evidenceEdges.add(buildEdge(target, canonical, type.get(), discovered, source, status));
        }

        GraphNode evidence = GraphNode.builder()
                .projectId(projectId)
                .nodeClass(NodeClass.NEXUS)
                .type(GraphNode.EVIDENCE_TYPE)
                .canonicalValue("result:" + UUID.randomUUID())
                .label(source + " result for " + searchedCanonical)
                .value(searchedCanonical)
                .comment(serializeRaw(response.getRaw()))
                .verificationStatus(status)
                .connectionReason("lookup:" + source)
                .embeddedEdges(evidenceEdges)
                .createdAt(now)
                .updatedAt(now)
                .lastSeen(now)
                .build();
        evidence.putMetadata("source", source);
        evidence.putMetadata("searched_type", searchedType.name());
        evidence = graphNodeRepository.save(evidence);

        searchedNode.getEmbeddedEdges().add(EmbeddedEdge.builder()
                .targetId(evidence.getId())
                .relation(PROVENANCE_RELATION)
                .verificationStatus(status)
                .connectionReason("lookup:" + source)
                .alreadySearched(true)
                .build());
        searchedNode.putMetadata(LAST_SEARCHED_KEY, now.toString());
        searchedNode.setLastSeen(now);
        searchedNode.setUpdatedAt(now);
        searchedNode = graphNodeRepository.save(searchedNode);
        registry.register(searchedCanonical, searchedNode.getId());

        log.info("Ingested {} result for {} [{}]: {} entities linked ({} new, {} skipped)",
                source, searchedCanonical, status, evidenceEdges.size(), created, skipped);

        return new IngestionResult(searchedNode.getId(), evidence.getId(), status, evidenceEdges.size(), created, skipped);
    }

    /**
     * A rediscovered entity that was already searched gets an edge that will not
     * put it back in a queue; promotion can still reach it by node id.
     */
    private EmbeddedEdge buildEdge(GraphNode target, String canonical, QueryType type, DiscoveredEntity discovered,
                                   String source, VerificationStatus status) {
        boolean searchedBefore = target.getMetadata() != null && target.getMetadata().containsKey(LAST_SEARCHED_KEY);
        String relation = discovered.getRelation() != null && !discovered.getRelation().isBlank()
                ? discovered.getRelation()
                : "mentions";

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("source", source);
        metadata.put("entity_type", type.name());
        if (discovered.getType() != null) {
            metadata.put("original_type", discovered.getType());
        }
        if (discovered.getContext() != null) {
            metadata.put("context", discovered.getContext());
        }

        EmbeddedEdge edge = EmbeddedEdge.builder()
                .targetId(target.getId())
                .relation(relation)
                .verificationStatus(status)
                .connectionReason(discovered.getRelation() != null ? discovered.getRelation() : "found_in_" + source)
                .alreadySearched(searchedBefore)
                .metadata(metadata)
                .build();
        if (status == VerificationStatus.UNVERIFIED && !searchedBefore) {
            edge.setQuerySequenceTag(canonical + "_1");
        }
        return edge;
    }

    private GraphNode newEntityNode(String projectId, QueryType type, String canonical, String rawValue,
                                    LocalDateTime now) {
        return GraphNode.builder()
                .projectId(projectId)
                .nodeClass(NodeClass.ENTITY)
                .type(type.getNodeType())
                .canonicalValue(canonical)
                .label(rawValue)
                .value(rawValue)
                .createdAt(now)
                .updatedAt(now)
                .lastSeen(now)
                .build();
    }

    private String serializeRaw(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            String json = objectMapper.writeValueAsString(raw);
            return json.length() > MAX_COMMENT_LENGTH ? json.substring(0, MAX_COMMENT_LENGTH) : json;
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize raw lookup output: {}", e.getMessage());
            return String.valueOf(raw);
        }
    }
}
