package com.focus.gate.engine.feature;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public record UrlParts(
        String raw,
        String lower,
        String domain,
        String path,
        Map<String, String> queryParams
) {

    public static UrlParts parse(String url) {
        String raw = url == null ? "" : url.trim();
        String lower = raw.toLowerCase(Locale.ROOT);

        String rest = lower;
        int scheme = rest.indexOf("://");
        if (scheme >= 0) {
            rest = rest.substring(scheme + 3);
        }

        int pathStart = indexOfAny(rest, '/', '?', '#');
        String authority = pathStart >= 0 ? rest.substring(0, pathStart) : rest;
        String remainder = pathStart >= 0 ? rest.substring(pathStart) : "";

        return new UrlParts(raw, lower, domainOf(authority), pathOf(remainder), queryOf(remainder));
    }

    public boolean domainMatches(String candidate) {
        return !domain.isEmpty() && (domain.equals(candidate) || domain.endsWith("." + candidate));
    }

    private static String domainOf(String authority) {
        String host = authority;
        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }
        int colon = host.indexOf(':');
        if (colon >= 0) {
            host = host.substring(0, colon);
        }
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host;
    }

    private static String pathOf(String remainder) {
        int end = indexOfAny(remainder, '?', '#');
        String path = end >= 0 ? remainder.substring(0, end) : remainder;
        return path.isEmpty() ? "/" : path;
    }

    private static Map<String, String> queryOf(String remainder) {
        int start = remainder.indexOf('?');
        if (start < 0) {
            return Map.of();
        }
        String query = remainder.substring(start + 1);
        int fragment = query.indexOf('#');
        if (fragment >= 0) {
            query = query.substring(0, fragment);
        }

        Map<String, String> params = new LinkedHashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            params.putIfAbsent(eq >= 0 ? pair.substring(0, eq) : pair, eq >= 0 ? pair.substring(eq + 1) : "");
        }
        return Map.copyOf(params);
    }

    private static int indexOfAny(String s, char... chars) {
        int best = -1;
        for (char c : chars) {
            int idx = s.indexOf(c);
            if (idx >= 0 && (best < 0 || idx < best)) {
                best = idx;
            }
        }
        return best;
    }
}
