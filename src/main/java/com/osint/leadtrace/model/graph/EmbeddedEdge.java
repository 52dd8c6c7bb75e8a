package com.osint.leadtrace.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed relation stored inside its source node's {@code embedded_edges} array.
 *
 * Only UNVERIFIED edges carry a {@code query_sequence_tag} ({@code <chainKey>_<n>});
 * promotion to VERIFIED clears it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddedEdge {

    @Field("target_id")
    private String targetId;

    @Field("relation")
    private String relation;

    @Field("verification_status")
    private VerificationStatus verificationStatus;

    @Field("connection_reason")
    private String connectionReason;

    @Field("additional_reasons")
    @Builder.Default
    private List<String> additionalReasons = new ArrayList<>();

    @Field("query_sequence_tag")
    private String querySequenceTag;

    @Field("already_searched")
    private boolean alreadySearched;

    @Field("upgrade_reason")
    private String upgradeReason;

    @Field("upgraded_at")
    private LocalDateTime upgradedAt;

    @Field("metadata")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public boolean isVerified() {
        return verificationStatus == VerificationStatus.VERIFIED;
    }

    public boolean isUnverified() {
        return verificationStatus == VerificationStatus.UNVERIFIED;
    }

    public void putMetadata(String key, Object value) {
        if (metadata == null) {
            metadata = new HashMap<>();
        }
        metadata.put(key, value);
    }
}
