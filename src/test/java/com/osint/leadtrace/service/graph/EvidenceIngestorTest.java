package com.osint.leadtrace.service.graph;

import com.osint.leadtrace.dto.lookup.DiscoveredEntity;
import com.osint.leadtrace.dto.lookup.LookupResponse;
import com.osint.leadtrace.model.graph.EmbeddedEdge;
import com.osint.leadtrace.model.graph.GraphNode;
import com.osint.leadtrace.model.graph.NodeClass;
import com.osint.leadtrace.model.graph.VerificationStatus;
import com.osint.leadtrace.repository.graph.GraphNodeRepository;
import com.osint.leadtrace.service.search.CanonicalValueNormalizer;
import com.osint.leadtrace.service.search.QueryType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvidenceIngestorTest {

    private static final String PROJECT = "project-1";

    @Mock
    private GraphNodeRepository graphNodeRepository;

    private EvidenceIngestor ingestor;
    private final AtomicInteger ids = new AtomicInteger();

    @BeforeEach
    void setUp() {
        ingestor = new EvidenceIngestor(graphNodeRepository, new CanonicalValueNormalizer());
        when(graphNodeRepository.save(any(GraphNode.class))).thenAnswer(invocation -> {
            GraphNode node = invocation.getArgument(0);
            if (node.getId() == null) {
                node.setId("n-" + ids.incrementAndGet());
            }
            return node;
        });
    }

    @Test
    void searchOnEmail_producesVerifiedEvidence() {
        LookupResponse response = response(
                entity("PHONE", "+1 (555) 123-4567", "same_breach_record"),
                entity("USERNAME", "Carol_User", null),
                entity("EMAIL", "ALICE@example.com", null),
                entity("SHOE_SIZE", "forty-two", null),
                entity("PHONE", "+15551234567", null),
                entity("USERNAME", "ab", null));

        IdentityRegistry registry = new IdentityRegistry();
        IngestionResult result = ingestor.ingest(PROJECT, "Alice@Example.com", QueryType.EMAIL, response, registry);

        assertThat(result.getVerificationStatus()).isEqualTo(VerificationStatus.VERIFIED);
        assertThat(result.getEntitiesLinked()).isEqualTo(2);
        assertThat(result.getEntitiesCreated()).isEqualTo(2);
        assertThat(result.getEntitiesSkipped()).isEqualTo(4);

        List<GraphNode> saved = captureSaves(4);
        GraphNode evidence = saved.get(2);
        assertThat(evidence.getNodeClass()).isEqualTo(NodeClass.NEXUS);
        assertThat(evidence.isEvidence()).isTrue();
        assertThat(evidence.getVerificationStatus()).isEqualTo(VerificationStatus.VERIFIED);
        assertThat(evidence.getComment()).isEqualTo("{\"records\":1}");
        assertThat(evidence.getEmbeddedEdges()).hasSize(2).allSatisfy(edge -> {
            assertThat(edge.getVerificationStatus()).isEqualTo(VerificationStatus.VERIFIED);
            assertThat(edge.getQuerySequenceTag()).isNull();
            assertThat(edge.isAlreadySearched()).isFalse();
        });
        assertThat(evidence.getEmbeddedEdges())
                .extracting(EmbeddedEdge::getConnectionReason)
                .containsExactly("same_breach_record", "found_in_breachdb");

        GraphNode searched = saved.get(3);
        assertThat(searched.getCanonicalValue()).isEqualTo("alice@example.com");
        assertThat(searched.getMetadata()).containsKey(EvidenceIngestor.LAST_SEARCHED_KEY);
        EmbeddedEdge provenance = searched.getEmbeddedEdges().get(0);
        assertThat(provenance.getTargetId()).isEqualTo(evidence.getId());
        assertThat(provenance.getRelation()).isEqualTo(EvidenceIngestor.PROVENANCE_RELATION);
        assertThat(provenance.isAlreadySearched()).isTrue();

        assertThat(registry.nodeIdFor("+15551234567")).isPresent();
        assertThat(registry.nodeIdFor("carol_user")).isPresent();
        assertThat(registry.nodeIdFor("alice@example.com")).contains(searched.getId());
    }

    @Test
    void searchOnUsername_producesTaggedUnverifiedEdges() {
        LookupResponse response = response(entity("EMAIL", "carol@example.com", "registered_with"));

        IngestionResult result = ingestor.ingest(PROJECT, "carol_user", QueryType.USERNAME, response,
                new IdentityRegistry());

        assertThat(result.getVerificationStatus()).isEqualTo(VerificationStatus.UNVERIFIED);
        GraphNode evidence = captureSaves(3).get(1);
        EmbeddedEdge edge = evidence.getEmbeddedEdges().get(0);
        assertThat(edge.getVerificationStatus()).isEqualTo(VerificationStatus.UNVERIFIED);
        assertThat(edge.getQuerySequenceTag()).isEqualTo("carol@example.com_1");
        assertThat(edge.isAlreadySearched()).isFalse();
        assertThat(edge.getRelation()).isEqualTo("registered_with");
    }

    @Test
    void rediscoveredSearchedEntity_isLinkedButNotRequeued() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(EvidenceIngestor.LAST_SEARCHED_KEY, "2026-01-01T10:00");
        GraphNode alice = GraphNode.builder()
                .id("n-alice")
                .projectId(PROJECT)
                .canonicalValue("alice@example.com")
                .metadata(metadata)
                .build();
        when(graphNodeRepository.findFirstByProjectIdAndCanonicalValue(eq(PROJECT), anyString()))
                .thenAnswer(invocation -> "alice@example.com".equals(invocation.getArgument(1))
                        ? Optional.of(alice)
                        : Optional.empty());

        IngestionResult result = ingestor.ingest(PROJECT, "carol_user", QueryType.USERNAME,
                response(entity("EMAIL", "alice@example.com", null)), new IdentityRegistry());

        assertThat(result.getEntitiesCreated()).isZero();
        GraphNode evidence = captureSaves(2).get(0);
        EmbeddedEdge edge = evidence.getEmbeddedEdges().get(0);
        assertThat(edge.getTargetId()).isEqualTo("n-alice");
        assertThat(edge.isAlreadySearched()).isTrue();
        assertThat(edge.getQuerySequenceTag()).isNull();
    }

    @Test
    void existingSearchedNodeIsReused() {
        GraphNode carol = GraphNode.builder()
                .id("n-carol")
                .projectId(PROJECT)
                .canonicalValue("carol_user")
                .embeddedEdges(new ArrayList<>())
                .build();
        when(graphNodeRepository.findFirstByProjectIdAndCanonicalValue(eq(PROJECT), anyString()))
                .thenAnswer(invocation -> "carol_user".equals(invocation.getArgument(1))
                        ? Optional.of(carol)
                        : Optional.empty());

        IngestionResult result = ingestor.ingest(PROJECT, "@carol_user", QueryType.USERNAME, response(),
                new IdentityRegistry());

        assertThat(result.getSearchedNodeId()).isEqualTo("n-carol");
        assertThat(result.getEntitiesLinked()).isZero();
        assertThat(carol.getEmbeddedEdges()).hasSize(1);
    }

    private List<GraphNode> captureSaves(int expected) {
        ArgumentCaptor<GraphNode> captor = ArgumentCaptor.forClass(GraphNode.class);
        verify(graphNodeRepository, times(expected)).save(captor.capture());
        return captor.getAllValues();
    }

    private static LookupResponse response(DiscoveredEntity... entities) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("records", 1);
        return LookupResponse.builder()
                .source("breachdb")
                .entities(new ArrayList<>(List.of(entities)))
                .raw(raw)
                .build();
    }

    private static DiscoveredEntity entity(String type, String value, String relation) {
        return DiscoveredEntity.builder().type(type).value(value).relation(relation).build();
    }
}
