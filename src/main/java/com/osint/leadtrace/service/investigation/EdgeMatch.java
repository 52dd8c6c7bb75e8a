package com.osint.leadtrace.service.investigation;

import com.osint.leadtrace.model.graph.EmbeddedEdge;

import java.util.Optional;

/**
 * How an UNVERIFIED edge was matched to the entity being promoted.
 *
 * EXACT_ID is precise. TAG_SUBSTRING catches edges addressed only by tag before the
 * entity had a node id, and can also catch unrelated chains whose key contains the
 * entity value.
 */
public enum EdgeMatch {
    EXACT_ID,
    TAG_SUBSTRING;

    /**
     * Classify an edge against the entity. Exact id wins over the tag fallback.
     *
     * @param entityId node id of the entity, or null when it could not be resolved
     */
    public static Optional<EdgeMatch> classify(EmbeddedEdge edge, String entityId, String entityValue) {
        if (entityId != null && entityId.equals(edge.getTargetId())) {
            return Optional.of(EXACT_ID);
        }
        String tag = edge.getQuerySequenceTag();
        if (tag != null && entityValue != null && !entityValue.isEmpty() && tag.contains(entityValue)) {
            return Optional.of(TAG_SUBSTRING);
        }
        return Optional.empty();
    }
}
