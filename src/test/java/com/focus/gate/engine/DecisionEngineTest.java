package com.focus.gate.engine;

import com.focus.gate.dto.AdmissionVerdict;
import com.focus.gate.dto.MissionDocument;
import com.focus.gate.dto.PageMetadata;
import com.focus.gate.dto.StatisticsView;
import com.focus.gate.model.AdmissionAction;
import com.focus.gate.model.DecisionRecord;
import com.focus.gate.repository.DecisionRecordRepository;
import com.focus.gate.repository.StatisticsSnapshotRepository;
import com.focus.gate.service.MissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class DecisionEngineTest {

    private static final String UNKNOWN_PAGE = "https://unknown-site.example/articles/42";

    @Autowired DecisionEngine engine;
    @Autowired MissionService missionService;
    @Autowired DecisionRecordRepository decisions;
    @Autowired StatisticsSnapshotRepository snapshots;

    @BeforeEach
    void setUp() {
        engine.clearCache();
        decisions.deleteAll();
        missionService.replace(new MissionDocument("Focus on Python programming", List.of(), List.of()));
    }

    private static PageMetadata page(String url, String title) {
        return PageMetadata.builder()
                .url(url)
                .title(title)
                .description("Notes and examples")
                .contentLength(4200)
                .linkCount(30)
                .build();
    }

    @Nested
    @DisplayName("Fast path")
    class FastPath {

        @Test
        void educationalDomainIsAllowed() {
            AdmissionVerdict verdict = engine.decide("https://github.com/org/repo");
            assertEquals(AdmissionAction.ALLOW, verdict.action());
            assertEquals("educational-domain", verdict.source());
            assertEquals(1.0, verdict.confidence());
        }

        @Test
        void shortFormVideoIsBlocked() {
            AdmissionVerdict verdict = engine.decide("https://www.youtube.com/shorts/abc123");
            assertEquals(AdmissionAction.BLOCK, verdict.action());
            assertEquals("short-form-feed", verdict.source());
        }

        @Test
        void secondCallWithinTtlIsACacheHit() {
            StatisticsView before = engine.statistics();

            AdmissionVerdict first = engine.decide("https://docs.python.org/3/");
            AdmissionVerdict second = engine.decide("https://docs.python.org/3/");

            assertFalse(first.cached());
            assertTrue(second.cached());
            assertEquals(first.action(), second.action());

            StatisticsView after = engine.statistics();
            assertEquals(before.totalDecisions() + 2, after.totalDecisions());
            assertEquals(before.cacheHits() + 1, after.cacheHits());
            assertEquals(before.fastPathDecisions() + 1, after.fastPathDecisions());
        }

        @Test
        void fastPathNeverPersists() {
            engine.decide("https://reddit.com/r/all");
            assertEquals(0, decisions.count());
        }
    }

    @Nested
    @DisplayName("Metadata path")
    class MetadataPath {

        @Test
        void ruleMatchShortCircuitsTheClassifier() {
            AdmissionVerdict verdict = engine.decideWithMetadata(
                    page("https://www.youtube.com/watch?v=zzz", "Funniest cat compilation"));
            assertEquals(AdmissionAction.BLOCK, verdict.action());
            assertEquals("watch-endpoint", verdict.source());
            assertEquals(0, decisions.count());
        }

        @Test
        void missionAlignedVideoIsAllowed() {
            AdmissionVerdict verdict = engine.decideWithMetadata(
                    page("https://www.youtube.com/watch?v=py1", "Python programming decorators"));
            assertEquals(AdmissionAction.ALLOW, verdict.action());
        }

        @Test
        void unknownDomainIsClassifiedAndRecorded() {
            AdmissionVerdict verdict = engine.decideWithMetadata(page(UNKNOWN_PAGE, "Python programming guide"));

            assertEquals(AdmissionVerdict.SOURCE_CLASSIFIER, verdict.source());
            assertTrue(verdict.confidence() >= 0 && verdict.confidence() <= 1);

            List<DecisionRecord> recorded = decisions.findByUrlOrderByIdAsc(UNKNOWN_PAGE);
            assertEquals(1, recorded.size());
            DecisionRecord record = recorded.get(0);
            assertEquals(verdict.action(), record.getAction());
            assertEquals("Focus on Python programming", record.getMission());
            assertEquals(1186 * Float.BYTES, record.getFeatures().length);
            assertNull(record.getCorrect());
        }

        @Test
        void slowPathRunsOnceWithinTtl() {
            engine.decideWithMetadata(page(UNKNOWN_PAGE, "Python programming guide"));
            AdmissionVerdict second = engine.decideWithMetadata(page(UNKNOWN_PAGE, "Python programming guide"));

            assertTrue(second.cached());
            assertEquals(1, decisions.findByUrlOrderByIdAsc(UNKNOWN_PAGE).size());
        }

        @Test
        void sparseMetadataStillGetsAVerdict() {
            AdmissionVerdict verdict = engine.decideWithMetadata(PageMetadata.basic(UNKNOWN_PAGE));
            assertEquals(AdmissionVerdict.SOURCE_CLASSIFIER, verdict.source());
        }

        @Test
        void thresholdAndModelStateAreReported() {
            StatisticsView stats = engine.statistics();
            assertEquals(0.5, stats.decisionThreshold());
            assertFalse(stats.modelTrained());
            assertEquals("Focus on Python programming", stats.mission());
        }
    }

    @Nested
    @DisplayName("Feedback")
    class Feedback {

        @Test
        void eachFeedbackUpdatesADifferentMoreRecentRecord() {
            engine.decideWithMetadata(page(UNKNOWN_PAGE, "Python programming guide"));
            engine.clearCache();
            engine.decideWithMetadata(page(UNKNOWN_PAGE, "Python programming guide"));
            List<DecisionRecord> recorded = decisions.findByUrlOrderByIdAsc(UNKNOWN_PAGE);
            assertEquals(2, recorded.size());
            Long older = recorded.get(0).getId();
            Long newer = recorded.get(1).getId();

            StatisticsView before = engine.statistics();

            assertTrue(engine.submitFeedback(UNKNOWN_PAGE, true));
            DecisionRecord first = decisions.findById(newer).orElseThrow();
            assertTrue(first.getCorrect());
            assertEquals(1.0, first.getReward());
            assertNull(decisions.findById(older).orElseThrow().getCorrect());

            assertTrue(engine.submitFeedback(UNKNOWN_PAGE, false));
            DecisionRecord second = decisions.findById(older).orElseThrow();
            assertFalse(second.getCorrect());
            assertEquals(-1.0, second.getReward());

            assertFalse(engine.submitFeedback(UNKNOWN_PAGE, true));

            StatisticsView after = engine.statistics();
            assertEquals(before.feedbackCount() + 2, after.feedbackCount());
            assertEquals(before.correctDecisions() + 1, after.correctDecisions());
        }

        @Test
        void feedbackUnderAnotherMissionFindsNothing() {
            engine.decideWithMetadata(page(UNKNOWN_PAGE, "Python programming guide"));
            missionService.replace(new MissionDocument("Write the quarterly report", List.of(), List.of()));
            assertFalse(engine.submitFeedback(UNKNOWN_PAGE, true));
        }

        @Test
        void statisticsAreFlushedEveryConfiguredFeedbackCount() {
            for (int i = 0; i < 2; i++) {
                engine.decideWithMetadata(page(UNKNOWN_PAGE + "?n=" + i, "Python programming guide"));
                assertTrue(engine.submitFeedback(UNKNOWN_PAGE + "?n=" + i, true));
            }
            assertTrue(snapshots.findAll().stream().anyMatch(s -> s.getFeedbackCount() >= 2));
        }
    }

    @Test
    void clearCacheForcesAFreshDecision() {
        engine.decide("https://github.com/org/repo");
        engine.clearCache();
        assertFalse(engine.decide("https://github.com/org/repo").cached());
        assertEquals(1, engine.statistics().cacheSize());
    }
}
