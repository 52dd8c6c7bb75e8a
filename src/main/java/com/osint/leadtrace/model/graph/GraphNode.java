package com.osint.leadtrace.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MongoDB document for one vertex of a project's evidence graph.
 * Outgoing edges are embedded; the document is the unit of update.
 *
 * Evidence nodes (type {@value #EVIDENCE_TYPE}) hold one lookup result each and
 * carry a node-level verification status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "graph_nodes")
@CompoundIndex(name = "project_canonical_idx", def = "{'projectId': 1, 'canonicalValue': 1}")
public class GraphNode {

    public static final String EVIDENCE_TYPE = "aggregator_result";

    @Id
    private String id;

    @Indexed
    private String projectId;

    private NodeClass nodeClass;

    private String type;            // email, phone, username, person, domain, aggregator_result...

    private String canonicalValue;  // normalized, used as queue / dedup key

    private String label;

    private String value;

    private String comment;         // raw lookup output on evidence nodes

    @Field("verification_status")
    private VerificationStatus verificationStatus;

    @Field("connection_reason")
    private String connectionReason;

    @Field("additional_reasons")
    @Builder.Default
    private List<String> additionalReasons = new ArrayList<>();

    @Field("query_sequence_tag")
    private String querySequenceTag;

    @Field("embedded_edges")
    @Builder.Default
    private List<EmbeddedEdge> embeddedEdges = new ArrayList<>();

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime lastSeen;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public boolean isEvidence() {
        return EVIDENCE_TYPE.equals(type);
    }

    public boolean isVerified() {
        return verificationStatus == VerificationStatus.VERIFIED;
    }

    public void putMetadata(String key, Object value) {
        if (metadata == null) {
            metadata = new HashMap<>();
        }
        metadata.put(key, value);
    }
}
