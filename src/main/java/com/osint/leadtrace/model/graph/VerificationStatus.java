package com.osint.leadtrace.model.graph;

/**
 * Confidence state of an edge (or of an evidence node as a whole).
 */
public enum VerificationStatus {
    VERIFIED,
    UNVERIFIED
}
