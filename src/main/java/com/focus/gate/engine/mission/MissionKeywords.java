package com.focus.gate.engine.mission;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class MissionKeywords {

    public static final int MAX_KEYWORDS = 20;

    private static final String STRIP = ".,:;!?'\"()[]{}";

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "about", "that", "this", "from", "into", "your", "their",
            "there", "then", "have", "will", "should", "would", "could", "what", "when", "where",
            "why", "how", "make", "create", "work", "task", "focus", "session", "goal", "doing",
            "do", "on", "to", "of", "in", "at", "a", "an"
    );

    private MissionKeywords() {
    }

    public static List<String> extract(String missionText) {
        if (missionText == null || missionText.isBlank()) {
            return List.of();
        }

        List<String> base = new ArrayList<>();
        for (String raw : missionText.toLowerCase(Locale.ROOT).split("\\s+")) {
            String token = strip(raw);
            if (token.length() >= 3 && !STOP_WORDS.contains(token)) {
                base.add(token);
            }
        }

        Set<String> keywords = new LinkedHashSet<>(base);
        for (int i = 0; i < base.size() - 1; i++) {
            keywords.add(base.get(i) + " " + base.get(i + 1));
        }

        return keywords.stream().limit(MAX_KEYWORDS).toList();
    }

    private static String strip(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && STRIP.indexOf(token.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && STRIP.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(start, end);
    }
}
