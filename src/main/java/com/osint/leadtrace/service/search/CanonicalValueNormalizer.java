package com.osint.leadtrace.service.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Produces the canonical value of an entity: the normalized string used as the
 * node dedup key and as the queue key.
 *
 * Format Rules:
 * - Email: trimmed, lower-case
 * - Phone: digits only, leading '+' kept
 * - Domain: host only, lower-case, no scheme / "www." / path / trailing dot
 * - Username: leading '@' removed, lower-case
 * - LinkedIn: linkedin.com/in/{slug}
 * - Name: whitespace collapsed, lower-case
 * - IP / hash: trimmed (hash lower-case)
 */
@Component
@Slf4j
public class CanonicalValueNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern NON_DIGIT = Pattern.compile("[^0-9]");

    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.-]*://", Pattern.CASE_INSENSITIVE);

    public String normalize(QueryType type, String value) {
        if (value == null) {
            log.warn("Cannot normalize null value of type {}", type);
            return "";
        }
        String trimmed = value.trim();

        switch (type) {
            case EMAIL:
                return trimmed.toLowerCase(Locale.ROOT);
            case PHONE:
                return normalizePhone(trimmed);
            case DOMAIN:
                return normalizeDomain(trimmed);
            case USERNAME:
                return (trimmed.startsWith("@") ? trimmed.substring(1) : trimmed).toLowerCase(Locale.ROOT);
            case LINKEDIN:
                return normalizeLinkedin(trimmed);
            case NAME:
                return WHITESPACE.matcher(trimmed).replaceAll(" ").toLowerCase(Locale.ROOT);
            case PASSWORD_HASH:
                return trimmed.toLowerCase(Locale.ROOT);
            case IP:
            default:
                return trimmed;
        }
    }

    /**
     * Examples:
     * - "+1 (555) 123-4567" -> "+15551234567"
     * - "555.123.4567" -> "5551234567"
     */
    private String normalizePhone(String phone) {
        String digits = NON_DIGIT.matcher(phone).replaceAll("");
        return phone.startsWith("+") ? "+" + digits : digits;
    }

    /**
     * Examples:
     * - "https://www.Example.com/about" -> "example.com"
     * - "example.com." -> "example.com"
     */
    private String normalizeDomain(String domain) {
        String host = SCHEME.matcher(domain).replaceFirst("").toLowerCase(Locale.ROOT);
        int pathStart = indexOfAny(host, '/', '?', '#');
        if (pathStart != -1) {
            host = host.substring(0, pathStart);
        }
        int portStart = host.indexOf(':');
        if (portStart != -1) {
            host = host.substring(0, portStart);
        }
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host;
    }

    /**
     * Examples:
     * - "https://www.linkedin.com/in/Jane-Doe/" -> "linkedin.com/in/jane-doe"
     */
    private String normalizeLinkedin(String url) {
        String path = SCHEME.matcher(url).replaceFirst("").toLowerCase(Locale.ROOT);
        if (path.startsWith("www.")) {
            path = path.substring(4);
        }
        int queryStart = indexOfAny(path, '?', '#');
        if (queryStart != -1) {
            path = path.substring(0, queryStart);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    private int indexOfAny(String value, char... chars) {
        int first = -1;
        for (char c : chars) {
            int idx = value.indexOf(c);
            if (idx != -1 && (first == -1 || idx < first)) {
                first = idx;
            }
        }
        return first;
    }
}
