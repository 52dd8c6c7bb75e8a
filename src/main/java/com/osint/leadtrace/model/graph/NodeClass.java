package com.osint.leadtrace.model.graph;

public enum NodeClass {
    ENTITY,
    NARRATIVE,
    NEXUS,
    LOCATION
}
