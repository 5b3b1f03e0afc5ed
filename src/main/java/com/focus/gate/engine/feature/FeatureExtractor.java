package com.focus.gate.engine.feature;

import com.focus.gate.dto.PageMetadata;
import com.focus.gate.engine.mission.Mission;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

@Slf4j
public class FeatureExtractor {

    private static final int HASH_FEATURES = 234;

    private final Clock clock;

    public FeatureExtractor(Clock clock) {
        this.clock = clock;
    }

    public FeatureVector extract(String url, Mission mission) {
        return extract(PageMetadata.basic(url), mission);
    }

    public FeatureVector extract(PageMetadata metadata, Mission mission) {
        String url = metadata.url();
        String missionText = mission == null ? "" : mission.text();
        UrlParts parts = UrlParts.parse(url);
        String contentText = contentText(metadata, parts);

        float[] values = new float[FeatureVector.DIMENSION];
        fill(values, FeatureVector.URL_TEXT_OFFSET, FeatureVector.TEXT_BLOCK,
                "url-text", () -> urlTextFeatures(parts.lower()));
        fill(values, FeatureVector.MISSION_TEXT_OFFSET, FeatureVector.TEXT_BLOCK,
                "mission-text", () -> missionTextFeatures(missionText.toLowerCase(Locale.ROOT)));
        fill(values, FeatureVector.CONTENT_TEXT_OFFSET, FeatureVector.TEXT_BLOCK,
                "content-text", () -> contentTextFeatures(contentText.toLowerCase(Locale.ROOT)));
        fill(values, FeatureVector.URL_STRUCTURE_OFFSET, FeatureVector.URL_STRUCTURE_BLOCK,
                "url-structure", () -> urlStructureFeatures(parts));
        fill(values, FeatureVector.CONTENT_OFFSET, FeatureVector.CONTENT_BLOCK,
                "content", () -> contentFeatures(metadata, mission));
        fill(values, FeatureVector.TEMPORAL_OFFSET, FeatureVector.TEMPORAL_BLOCK,
                "temporal", this::temporalFeatures);
        return new FeatureVector(values);
    }

    private void fill(float[] target, int offset, int length, String block, Supplier<float[]> features) {
        try {
            float[] computed = features.get();
            System.arraycopy(computed, 0, target, offset, Math.min(length, computed.length));
        } catch (RuntimeException e) {
            // Leaves the block at its zero defaults
            log.warn("Feature block {} failed, using defaults: {}", block, e.getMessage());
        }
    }

    // lexical blocks

    float[] urlTextFeatures(String url) {
        Block block = new Block(FeatureVector.TEXT_BLOCK);

        block.add(url.length());
        block.add(count(url, '/') + 1);
        block.add(count(url, '.') + 1);
        block.add(count(url, '/'));
        block.add(count(url, '?'));
        block.add(count(url, '&'));
        block.add(count(url, '='));
        block.add(count(url, '-'));
        block.add(count(url, '_'));
        block.add(count(url, '%'));
        int q = url.indexOf('?');
        block.add(q >= 0 ? q : url.length());
        block.add(flag(url.contains("https")));
        block.add(flag(url.contains("www")));
        block.add(flag(url.contains(".com")));
        block.add(flag(url.contains(".org")));
        block.add(flag(url.contains(".edu")));
        block.add(flag(url.contains(".gov")));
        block.add(letters(url));
        block.add(digits(url));
        block.add(symbols(url));
        block.padTo(50);

        for (String term : List.of("youtube", "reddit", "github", "stackoverflow", "wikipedia", "docs",
                "learn", "tutorial", "course", "video", "watch", "search")) {
            block.add(occurrences(url, term));
        }
        block.add(flag(containsAny(url, "api", "doc", "guide")));
        block.add(flag(containsAny(url, "game", "play", "fun")));
        block.add(count(url, '/'));
        block.padTo(150);

        List<String> words = words(url.replaceAll("[^a-z0-9]", " "));
        String head = String.join(" ", words.subList(0, Math.min(5, words.size())));
        for (int i = 0; i < HASH_FEATURES; i++) {
            block.add(TextHashing.bucket("url_" + i + "_" + head));
        }
        return block.values();
    }

    float[] missionTextFeatures(String mission) {
        Block block = new Block(FeatureVector.TEXT_BLOCK);
        List<String> words = words(mission);

        block.add(mission.length());
        block.add(words.size());
        block.add(new HashSet<>(words).size());
        block.add(count(mission, ' '));
        block.add(count(mission, '.'));
        block.add(count(mission, ','));
        block.add(count(mission, '!'));
        block.add(count(mission, '?'));
        block.add(count(mission, ';'));
        block.add(count(mission, ':'));
        block.add(letters(mission));
        block.add(digits(mission));
        block.add(symbols(mission));
        block.add(averageLength(words));
        block.add(maxLength(words));
        block.padTo(50);

        block.add(termsPresent(mission, "learn", "study", "understand", "master", "tutorial"));
        block.add(termsPresent(mission, "work", "job", "project", "task", "complete"));
        block.add(termsPresent(mission, "create", "build", "develop", "design", "make"));
        block.add(termsPresent(mission, "research", "find", "information", "data", "explore"));
        block.add(termsPresent(mission, "skill", "practice", "improve", "training", "course"));
        block.add(words.size());
        block.add(count(mission, '?'));
        block.add(count(mission, '.'));
        block.padTo(150);

        for (int i = 0; i < HASH_FEATURES; i++) {
            String word = i < words.size() ? words.get(i) : "empty";
            block.add(TextHashing.bucket("mission_" + i + "_" + word));
        }
        return block.values();
    }

    float[] contentTextFeatures(String content) {
        Block block = new Block(FeatureVector.TEXT_BLOCK);
        List<String> words = words(content);
        int sentences = count(content, '.') + 1;

        block.add(content.length());
        block.add(words.size());
        block.add(new HashSet<>(words).size());
        block.add(sentences);
        block.add(count(content, ' '));
        block.add(count(content, '.'));
        block.add(count(content, ','));
        block.add(count(content, '!'));
        block.add(count(content, '?'));
        block.add(count(content, ':'));
        block.add(count(content, ';'));
        block.add(count(content, '"'));
        block.add(count(content, '\''));
        block.add(letters(content));
        block.add(digits(content));
        block.add(averageLength(words));
        block.add(maxLength(words));
        block.add(words.stream().filter(w -> w.length() > 10).count());
        block.add(occurrences(content, "http"));
        block.add(occurrences(content, "www"));
        block.padTo(50);

        block.add(termsPresent(content, "title", "heading", "header"));
        block.add(termsPresent(content, "description", "summary", "about"));
        block.add(termsPresent(content, "tutorial", "guide", "how to", "step"));
        block.add(termsPresent(content, "documentation", "docs", "api", "reference"));
        block.add(termsPresent(content, "learn", "course", "lesson", "education"));
        block.add(flag(content.contains("•") || count(content, '-') > 3));
        block.add(flag(content.contains("code") || content.contains("function")));
        block.add((double) count(content, '?') / Math.max(words.size(), 1));
        block.add(sentences);
        block.add(maxLength(words));
        block.padTo(150);

        List<String> head = words.subList(0, Math.min(20, words.size()));
        for (int i = 0; i < HASH_FEATURES; i++) {
            String word = i < head.size() ? head.get(i) : "empty";
            block.add(TextHashing.bucket("content_" + i + "_" + word));
        }
        return block.values();
    }

    // structural and derived blocks

    float[] urlStructureFeatures(UrlParts parts) {
        Block block = new Block(FeatureVector.URL_STRUCTURE_BLOCK);
        String domain = parts.domain();
        String path = parts.path();

        block.add(count(domain, '.') + 1);
        block.add(flag(domain.endsWith(".edu")));
        block.add(flag(domain.endsWith(".org")));
        block.add(flag(domain.endsWith(".gov")));
        block.add(flag(domain.contains("docs") || domain.contains("documentation")));
        block.add(count(path, '/') + 1);
        block.add(flag(path.contains("/watch") || path.contains("/video")));
        block.add(flag(containsAny(path, "/article", "/post", "/blog")));
        block.add(flag(path.contains("/search") || path.contains("/results")));
        block.add(flag(path.contains("/user") || path.contains("/profile")));
        block.add(parts.queryParams().size());
        block.add(flag(parts.queryParams().containsKey("q") || parts.queryParams().containsKey("search")));
        block.add(parts.lower().length());
        block.add(count(parts.lower(), '&'));
        block.add(flag(parts.lower().contains("https")));
        return block.values();
    }

    float[] contentFeatures(PageMetadata metadata, Mission mission) {
        Block block = new Block(FeatureVector.CONTENT_BLOCK);
        int educational = Math.max(metadata.educationalIndicators(), 0);
        int entertainment = Math.max(metadata.entertainmentIndicators(), 0);

        block.add(flag(!metadata.title().isBlank()));
        block.add(flag(!metadata.description().isBlank()));
        block.add(metadata.keywords().size());
        block.add(metadata.contentLength() / 10000.0);
        block.add(metadata.linkCount() / 100.0);
        block.add(Math.min(educational / 10.0, 1.0));
        block.add(Math.min(entertainment / 10.0, 1.0));
        block.add(metadata.qualityScore());
        if (entertainment > 0) {
            block.add(Math.min((double) educational / entertainment, 5.0) / 5.0);
        } else {
            block.add(flag(educational > 0));
        }

        int titleHits = mission == null ? 0 : mission.keywordHits(metadata.title());
        int descriptionHits = mission == null ? 0 : mission.keywordHits(metadata.description());
        int keywordHits = mission == null ? 0 : mission.keywordHits(String.join(" ", metadata.keywords()));
        block.add(Math.min(titleHits / 3.0, 1.0));
        block.add(Math.min(descriptionHits / 5.0, 1.0));
        block.add(Math.min(keywordHits / 5.0, 1.0));
        block.add(flag(metadata.hasVideo()));
        block.add(flag(metadata.hasForms()));
        block.add(Math.min(metadata.extractedText().length() / 1000.0, 1.0));
        return block.values();
    }

    float[] temporalFeatures() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        int hour = now.getHour();
        int weekday = now.getDayOfWeek().getValue() - 1; // Monday = 0

        return new float[] {
                hour / 23.0f,
                weekday / 6.0f,
                flag(hour >= 9 && hour <= 17),
                flag(now.getDayOfWeek() == DayOfWeek.SATURDAY || now.getDayOfWeek() == DayOfWeek.SUNDAY)
        };
    }

    String contentText(PageMetadata metadata, UrlParts parts) {
        List<String> sections = new ArrayList<>();
        if (metadata.educationalIndicators() > 0) {
            sections.add("Educational Content Score: " + metadata.educationalIndicators());
        }
        if (metadata.entertainmentIndicators() > 0) {
            sections.add("Entertainment Content Score: " + metadata.entertainmentIndicators());
        }
        if (!metadata.title().isBlank()) {
            sections.add("Page Title: " + metadata.title());
        }
        if (!metadata.description().isBlank()) {
            sections.add("Description: " + truncate(metadata.description(), 200));
        }
        if (!metadata.keywords().isEmpty()) {
            sections.add("Keywords: " + String.join(" ", metadata.keywords().subList(0, Math.min(10, metadata.keywords().size()))));
        }
        if (!metadata.extractedText().isBlank()) {
            sections.add("Content: " + truncate(metadata.extractedText(), 200));
        }
        if (metadata.qualityScore() > 0) {
            sections.add(String.format(Locale.ROOT, "Quality Score: %.2f", metadata.qualityScore()));
        }

        if (!sections.isEmpty()) {
            return String.join(" | ", sections);
        }

        String bare = parts.lower();
        int scheme = bare.indexOf("://");
        if (scheme >= 0) {
            bare = bare.substring(scheme + 3);
        }
        return "Website: " + bare.replace('/', ' ').replace('-', ' ').replace('_', ' ');
    }

    private static List<String> words(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    private static int occurrences(String s, String term) {
        int n = 0;
        int from = s.indexOf(term);
        while (from >= 0) {
            n++;
            from = s.indexOf(term, from + term.length());
        }
        return n;
    }

    private static int termsPresent(String s, String... terms) {
        int n = 0;
        for (String term : terms) {
            if (s.contains(term)) {
                n++;
            }
        }
        return n;
    }

    private static boolean containsAny(String s, String... terms) {
        return termsPresent(s, terms) > 0;
    }

    private static int letters(String s) {
        return (int) s.chars().filter(Character::isLetter).count();
    }

    private static int digits(String s) {
        return (int) s.chars().filter(Character::isDigit).count();
    }

    private static int symbols(String s) {
        return (int) s.chars().filter(c -> !Character.isLetterOrDigit(c)).count();
    }

    private static double averageLength(List<String> words) {
        return words.stream().mapToInt(String::length).sum() / (double) Math.max(words.size(), 1);
    }

    private static int maxLength(List<String> words) {
        return words.stream().mapToInt(String::length).max().orElse(0);
    }

    private static float flag(boolean condition) {
        return condition ? 1.0f : 0.0f;
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static final class Block {
        private final float[] values;
        private int cursor;

        Block(int size) {
            this.values = new float[size];
        }

        void add(double value) {
            if (cursor < values.length) {
                values[cursor] = (float) value;
            }
            cursor++;
        }

        void padTo(int position) {
            cursor = Math.max(cursor, position);
        }

        float[] values() {
            return values;
        }
    }
}
