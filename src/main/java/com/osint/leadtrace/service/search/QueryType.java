package com.osint.leadtrace.service.search;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of value the lookup service can be searched on.
 *
 * Searching ON a unique identifier (email, phone, domain, IP, profile URL, hash)
 * yields VERIFIED results; searching ON an ambiguous one (username, name) yields
 * UNVERIFIED results, whatever the confidence of the lead that produced it.
 */
public enum QueryType {
    EMAIL("email", "email", true),
    PHONE("phone", "phone", true),
    LINKEDIN("linkedin", "linkedin", true),
    IP("ip", "ip", true),
    PASSWORD_HASH("password", "password_hash", true),
    DOMAIN("whois", "domain", true),
    USERNAME("username", "username", false),
    NAME("people", "person", false);

    private final String lookupPath;
    private final String nodeType;
    private final boolean verifying;

    QueryType(String lookupPath, String nodeType, boolean verifying) {
        this.lookupPath = lookupPath;
        this.nodeType = nodeType;
        this.verifying = verifying;
    }

    public String getLookupPath() {
        return lookupPath;
    }

    public String getNodeType() {
        return nodeType;
    }

    public boolean isVerifying() {
        return verifying;
    }

    public static Optional<QueryType> fromNodeType(String nodeType) {
        if (nodeType == null) {
            return Optional.empty();
        }
        for (QueryType type : values()) {
            if (type.nodeType.equalsIgnoreCase(nodeType)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Map an entity type reported by the lookup service. Unknown types are not followed.
     */
    public static Optional<QueryType> fromEntityType(String entityType) {
        if (entityType == null) {
            return Optional.empty();
        }
        switch (entityType.trim().toUpperCase(Locale.ROOT)) {
            case "EMAIL":
            case "MAIL":
                return Optional.of(EMAIL);
            case "PHONE":
            case "TELEPHONE":
            case "MOBILE":
                return Optional.of(PHONE);
            case "PERSON":
            case "NAME":
            case "FULL_NAME":
            case "NAME_VARIATION":
            case "COMPANY":
            case "ORGANIZATION":
                return Optional.of(NAME);
            case "DOMAIN":
            case "WEBSITE":
                return Optional.of(DOMAIN);
            case "IP":
            case "IP_ADDRESS":
                return Optional.of(IP);
            case "URL":
            case "LINKEDIN":
            case "LINKEDIN_URL":
            case "SOCIAL_URL":
                return Optional.of(LINKEDIN);
            case "USERNAME":
            case "ACCOUNT":
                return Optional.of(USERNAME);
            case "PASSWORD_HASH":
            case "HASH":
                return Optional.of(PASSWORD_HASH);
            default:
                return Optional.empty();
        }
    }
}
