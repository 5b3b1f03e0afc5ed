package com.focus.gate.engine.mission;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MissionKeywordsTest {

    @Nested
    @DisplayName("Keyword extraction")
    class Extraction {

        @Test
        void dropsStopWordsAndShortTokens_addsBigrams() {
            assertEquals(List.of("python", "programming", "python programming"),
                    MissionKeywords.extract("Focus on Python programming"));
        }

        @Test
        void stripsPunctuationFromTokenEnds() {
            List<String> keywords = MissionKeywords.extract("Learn (Rust), then: build compilers!");
            assertTrue(keywords.contains("learn"));
            assertTrue(keywords.contains("rust"));
            assertTrue(keywords.contains("build"));
            assertTrue(keywords.contains("compilers"));
            assertFalse(keywords.contains("then"));
        }

        @Test
        void deduplicatesAndCapsAtTwenty() {
            String text = "alpha beta gamma delta epsilon zeta theta iota kappa lambda sigma omega alpha beta";
            List<String> keywords = MissionKeywords.extract(text);
            assertEquals(MissionKeywords.MAX_KEYWORDS, keywords.size());
            assertEquals(1, keywords.stream().filter("alpha"::equals).count());
        }

        @Test
        void blankText_yieldsNoKeywords() {
            assertTrue(MissionKeywords.extract("   ").isEmpty());
            assertTrue(MissionKeywords.extract(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("Mission alignment")
    class Alignment {

        @Test
        void allowedKeywordsAreAppended() {
            Mission mission = Mission.of("Study distributed systems", List.of("Raft.io "), List.of("Consensus"));
            assertEquals(List.of("raft.io"), mission.allowedDomains());
            assertTrue(mission.keywords().contains("consensus"));
            assertEquals("study", mission.keywords().get(0));
        }

        @Test
        void alignsWith_isCaseInsensitiveSubstringMatch() {
            Mission mission = Mission.of("Focus on Python programming");
            assertTrue(mission.alignsWith("Advanced PYTHON decorators explained"));
            assertFalse(mission.alignsWith("Funny cat compilation"));
            assertFalse(mission.alignsWith(""));
        }

        @Test
        void keywordHits_countsEachMatchingKeyword() {
            Mission mission = Mission.of("Focus on Python programming");
            assertEquals(3, mission.keywordHits("python programming basics"));
            assertEquals(1, mission.keywordHits("python snakes"));
        }
    }
}
