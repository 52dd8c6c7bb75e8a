package com.osint.leadtrace.service.graph;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical value to node id mapping for one investigation run.
 *
 * A registry is created per run and shared by the scheduler components and the
 * search executor of that run; it is never global. Only resolved identities are
 * recorded, and node ids never change once assigned.
 */
public class IdentityRegistry {

    private final Map<String, String> nodeIdsByValue = new HashMap<>();
    private final Map<String, String> valuesByNodeId = new HashMap<>();

    public void register(String canonicalValue, String nodeId) {
        if (canonicalValue == null || nodeId == null) {
            return;
        }
        nodeIdsByValue.put(canonicalValue, nodeId);
        valuesByNodeId.put(nodeId, canonicalValue);
    }

    public Optional<String> nodeIdFor(String canonicalValue) {
        return Optional.ofNullable(nodeIdsByValue.get(canonicalValue));
    }

    public Optional<String> valueFor(String nodeId) {
        return Optional.ofNullable(valuesByNodeId.get(nodeId));
    }

    public int size() {
        return nodeIdsByValue.size();
    }

    public void reset() {
        nodeIdsByValue.clear();
        valuesByNodeId.clear();
    }
}
