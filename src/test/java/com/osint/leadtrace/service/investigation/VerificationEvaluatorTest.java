package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.model.graph.EmbeddedEdge;
import com.osint.leadtrace.model.graph.GraphNode;
import com.osint.leadtrace.model.graph.VerificationStatus;
import com.osint.leadtrace.service.graph.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationEvaluatorTest {

    private static final String PROJECT = "project-1";

    private InMemoryGraphStore store;
    private VerificationEvaluator evaluator;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        evaluator = new VerificationEvaluator(store);
    }

    @Test
    void rejects_whenEntityHasNoNode() {
        VerificationDecision decision = evaluator.check("ghost_user", PROJECT);

        assertThat(decision.isShouldUpgrade()).isFalse();
        assertThat(decision.getReason()).isEqualTo(VerificationDecision.ENTITY_NOT_FOUND);
    }

    @Test
    void upgrades_whenReferencedByVerifiedEvidence() {
        String carol = entity("carol_user");
        GraphNode breach = store.save(evidence(VerificationStatus.VERIFIED, edge(carol, VerificationStatus.VERIFIED)));

        VerificationDecision decision = evaluator.check("carol_user", PROJECT);

        assertThat(decision.isShouldUpgrade()).isTrue();
        assertThat(decision.getReason()).isEqualTo("found_with_verified_entities:1x");
        assertThat(decision.getEvidence()).containsExactly("same_breach_record:" + breach.getId());
    }

    @Test
    void upgrades_whenCooccurringWithVerifiedSibling() {
        String carol = entity("carol_user");
        String bob = entity("bob_phone");
        String dan = entity("dan@example.com");
        store.save(evidence(VerificationStatus.UNVERIFIED,
                edge(carol, VerificationStatus.UNVERIFIED),
                edge(bob, VerificationStatus.VERIFIED),
                edge(dan, VerificationStatus.VERIFIED)));

        VerificationDecision decision = evaluator.check("carol_user", PROJECT);

        assertThat(decision.isShouldUpgrade()).isTrue();
        assertThat(decision.getEvidence()).containsExactly("cooccurs_with_verified:" + bob);
    }

    @Test
    void countsOneCorroborationPerEvidenceNode() {
        String carol = entity("carol_user");
        String bob = entity("bob_phone");
        store.save(evidence(VerificationStatus.VERIFIED, edge(carol, VerificationStatus.VERIFIED)));
        store.save(evidence(VerificationStatus.UNVERIFIED,
                edge(carol, VerificationStatus.UNVERIFIED), edge(bob, VerificationStatus.VERIFIED)));

        VerificationDecision decision = evaluator.check("carol_user", PROJECT);

        assertThat(decision.getReason()).isEqualTo("found_with_verified_entities:2x");
        assertThat(decision.getEvidence()).hasSize(2);
    }

    @Test
    void ignoresEntitysOwnVerifiedEdge_whenLookingForSiblings() {
        String carol = entity("carol_user");
        String eve = entity("eve_user");
        store.save(evidence(VerificationStatus.UNVERIFIED,
                edge(carol, VerificationStatus.VERIFIED),
                edge(eve, VerificationStatus.UNVERIFIED)));

        VerificationDecision decision = evaluator.check("carol_user", PROJECT);

        assertThat(decision.isShouldUpgrade()).isFalse();
        assertThat(decision.getReason()).isEqualTo(VerificationDecision.NO_VERIFIED_CONNECTIONS);
    }

    @Test
    void reportsStoreFailureAsReason() {
        entity("carol_user");
        store.setFailing(true);

        VerificationDecision decision = evaluator.check("carol_user", PROJECT);

        assertThat(decision.isShouldUpgrade()).isFalse();
        assertThat(decision.getReason()).startsWith("error:");
    }

    private String entity(String canonicalValue) {
        return store.save(GraphNode.builder()
                .projectId(PROJECT)
                .type("entity")
                .canonicalValue(canonicalValue)
                .build()).getId();
    }

    private static GraphNode evidence(VerificationStatus status, EmbeddedEdge... edges) {
        return GraphNode.builder()
                .projectId(PROJECT)
                .type(GraphNode.EVIDENCE_TYPE)
                .verificationStatus(status)
                .embeddedEdges(new ArrayList<>(List.of(edges)))
                .build();
    }

    private static EmbeddedEdge edge(String targetId, VerificationStatus status) {
        return EmbeddedEdge.builder()
                .targetId(targetId)
                .verificationStatus(status)
                .build();
    }
}
