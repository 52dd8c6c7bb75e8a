package com.osint.leadtrace.service.search;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects what kind of identifier a free-form query is and strips query markers.
 *
 * Markers:
 * - "u:carol" / "username:carol" force a username search
 * - "whois!:example.com" forces a domain search
 * - a trailing "?" is ignored
 */
@Component
public class QueryTypeDetector {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private static final Pattern LINKEDIN_PATTERN =
            Pattern.compile("^(https?://)?(www\\.)?linkedin\\.com/in/[^/]+/?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern IP_PATTERN =
            Pattern.compile("^((25[0-5]|(2[0-4]|1\\d|[1-9]|)\\d)\\.?\\b){4}$");

    private static final Pattern HASH_PATTERN =
            Pattern.compile("^[a-fA-F0-9]{32}$|^[a-fA-F0-9]{40}$|^[a-fA-F0-9]{64}$");

    private static final Pattern PHONE_PATTERN =
            Pattern.compile("^(\\+?\\d{1,4}[\\s.-]?)?\\(?\\d{1,4}\\)?[\\s.-]?\\d{1,4}[\\s.-]?\\d{1,4}[\\s.-]?\\d{1,9}$");

    private static final Pattern DOMAIN_PATTERN =
            Pattern.compile("^([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]{2,}$", Pattern.CASE_INSENSITIVE);

    private static final Pattern USERNAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{3,}$");

    private static final Pattern WHOIS_PREFIX = Pattern.compile("^whois!\\s*:\\s*(.+)$", Pattern.CASE_INSENSITIVE);

    /**
     * IP addresses and hashes are tested before phone numbers, which their digit
     * runs would otherwise also match.
     */
    public QueryType detect(String query) {
        if (query == null || query.isBlank()) {
            return QueryType.USERNAME;
        }
        String trimmed = query.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);

        if (lower.startsWith("u:") || lower.startsWith("username:")) {
            return QueryType.USERNAME;
        }
        if (WHOIS_PREFIX.matcher(trimmed).matches()) {
            return QueryType.DOMAIN;
        }

        String value = stripTrailingMarker(trimmed);
        if (EMAIL_PATTERN.matcher(value).matches()) {
            return QueryType.EMAIL;
        }
        if (LINKEDIN_PATTERN.matcher(value).matches()) {
            return QueryType.LINKEDIN;
        }
        if (IP_PATTERN.matcher(value).matches()) {
            return QueryType.IP;
        }
        if (HASH_PATTERN.matcher(value).matches()) {
            return QueryType.PASSWORD_HASH;
        }
        if (PHONE_PATTERN.matcher(value).matches()) {
            return QueryType.PHONE;
        }
        if (DOMAIN_PATTERN.matcher(value).matches()) {
            return QueryType.DOMAIN;
        }
        if (USERNAME_PATTERN.matcher(value).matches()) {
            return QueryType.USERNAME;
        }
        if (value.contains(" ")) {
            return QueryType.NAME;
        }
        return QueryType.USERNAME;
    }

    /**
     * The value to search for once markers are removed.
     */
    public String extractQueryValue(String query, QueryType type) {
        if (query == null) {
            return "";
        }
        String trimmed = query.trim();
        if (type == QueryType.DOMAIN) {
            Matcher matcher = WHOIS_PREFIX.matcher(trimmed);
            if (matcher.matches()) {
                return stripTrailingMarker(matcher.group(1).trim());
            }
        }
        if (type == QueryType.USERNAME) {
            String lower = trimmed.toLowerCase(Locale.ROOT);
            if (lower.startsWith("username:")) {
                return stripTrailingMarker(trimmed.substring(9).trim());
            }
            if (lower.startsWith("u:")) {
                return stripTrailingMarker(trimmed.substring(2).trim());
            }
        }
        return stripTrailingMarker(trimmed);
    }

    private String stripTrailingMarker(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '?') {
            end--;
        }
        return value.substring(0, end).trim();
    }
}
