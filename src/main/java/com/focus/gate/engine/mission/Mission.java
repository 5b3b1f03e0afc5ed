package com.focus.gate.engine.mission;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public record Mission(
        String text,
        List<String> allowedDomains,
        List<String> allowedKeywords,
        List<String> keywords
) {

    public Mission {
        Objects.requireNonNull(text, "text");
        allowedDomains = normalize(allowedDomains);
        allowedKeywords = normalize(allowedKeywords);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public static Mission of(String text, List<String> allowedDomains, List<String> allowedKeywords) {
        Set<String> keywords = new LinkedHashSet<>(MissionKeywords.extract(text));
        keywords.addAll(normalize(allowedKeywords));
        return new Mission(text.trim(), allowedDomains, allowedKeywords, List.copyOf(keywords));
    }

    public static Mission of(String text) {
        return of(text, List.of(), List.of());
    }

    public boolean alignsWith(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }

    public int keywordHits(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return (int) keywords.stream().filter(lower::contains).count();
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .filter(v -> !v.isEmpty())
                .distinct()
                .toList();
    }
}
