package com.focus.gate.engine.feature;

import com.focus.gate.dto.PageMetadata;
import com.focus.gate.engine.mission.Mission;
import com.focus.gate.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {

    // Wednesday 2024-03-13 10:30 UTC
    private static final Instant WEDNESDAY_MORNING = Instant.parse("2024-03-13T10:30:00Z");

    private MutableClock clock;
    private FeatureExtractor extractor;
    private Mission mission;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(WEDNESDAY_MORNING);
        extractor = new FeatureExtractor(clock);
        mission = Mission.of("Focus on Python programming");
    }

    @Nested
    @DisplayName("Vector shape and determinism")
    class Shape {

        @Test
        void alwaysProducesFullDimension() {
            assertEquals(FeatureVector.DIMENSION, extractor.extract("https://github.com/org/repo", mission).dimension());
            assertEquals(1186, FeatureVector.DIMENSION);
        }

        @Test
        void identicalInputs_identicalVectors() {
            FeatureVector first = extractor.extract("https://realpython.com/python-decorators/", mission);
            FeatureVector second = new FeatureExtractor(new MutableClock(WEDNESDAY_MORNING))
                    .extract("https://realpython.com/python-decorators/", Mission.of("Focus on Python programming"));
            assertEquals(first, second);
        }

        @Test
        void hashedSlotsAreStableAcrossRuns() {
            assertEquals(TextHashing.bucket("mission_0_focus"), TextHashing.bucket("mission_0_focus"));
            float bucket = TextHashing.bucket("url_0_github com");
            assertTrue(bucket >= 0f && bucket < 1f);
        }

        @Test
        void malformedUrlAndMissingMission_yieldDefaultsNotErrors() {
            FeatureVector vector = assertDoesNotThrow(() -> extractor.extract("%%not a url%%", null));
            assertEquals(FeatureVector.DIMENSION, vector.dimension());
            // no title, no description
            assertEquals(0f, vector.get(FeatureVector.CONTENT_OFFSET));
            assertEquals(0f, vector.get(FeatureVector.CONTENT_OFFSET + 1));
        }

        @Test
        void bytesRoundTripPreservesValues() {
            FeatureVector vector = extractor.extract("https://github.com/org/repo", mission);
            assertEquals(vector, FeatureVector.fromBytes(vector.toBytes()));
        }
    }

    @Nested
    @DisplayName("Derived blocks")
    class DerivedBlocks {

        @Test
        void temporalBlockReadsInjectedClock() {
            FeatureVector vector = extractor.extract("https://github.com", mission);
            int t = FeatureVector.TEMPORAL_OFFSET;
            assertEquals(10 / 23.0f, vector.get(t), 1e-6);
            assertEquals(2 / 6.0f, vector.get(t + 1), 1e-6);
            assertEquals(1f, vector.get(t + 2));
            assertEquals(0f, vector.get(t + 3));

            clock.set(Instant.parse("2024-03-16T22:00:00Z")); // Saturday night
            FeatureVector weekend = extractor.extract("https://github.com", mission);
            assertEquals(0f, weekend.get(t + 2));
            assertEquals(1f, weekend.get(t + 3));
        }

        @Test
        void contentBlockCountsMissionHitsInTitle() {
            PageMetadata metadata = PageMetadata.builder()
                    .url("https://www.youtube.com/watch?v=abc")
                    .title("Python programming for beginners")
                    .description("Full course")
                    .keywords(List.of("python", "tutorial"))
                    .hasVideo(true)
                    .educationalIndicators(4)
                    .build();

            FeatureVector vector = extractor.extract(metadata, mission);
            int c = FeatureVector.CONTENT_OFFSET;
            assertEquals(1f, vector.get(c));          // has title
            assertEquals(1f, vector.get(c + 1));      // has description
            assertEquals(2f, vector.get(c + 2));      // keyword count
            assertEquals(0.4f, vector.get(c + 5), 1e-6);
            assertEquals(1f, vector.get(c + 8));      // educational with no entertainment
            assertEquals(1f, vector.get(c + 9), 1e-6); // three title hits, capped
            assertEquals(1f, vector.get(c + 12));     // has video
        }

        @Test
        void urlStructureFlagsWatchPathsAndQueries() {
            FeatureVector vector = extractor.extract("https://www.youtube.com/watch?v=abc&t=10", mission);
            int s = FeatureVector.URL_STRUCTURE_OFFSET;
            assertEquals(2f, vector.get(s));      // youtube.com has two labels
            assertEquals(1f, vector.get(s + 6));  // watch path
            assertEquals(2f, vector.get(s + 10)); // query parameters
            assertEquals(1f, vector.get(s + 14)); // https
        }

        @Test
        void contentTextFallsBackToUrlWords() {
            String text = extractor.contentText(PageMetadata.basic("https://docs.python.org/3/library"),
                    UrlParts.parse("https://docs.python.org/3/library"));
            assertEquals("Website: docs.python.org 3 library", text);
        }
    }
}
