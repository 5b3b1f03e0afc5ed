package com.focus.gate.engine;

import com.focus.gate.dto.AdmissionVerdict;
import com.focus.gate.dto.PageMetadata;
import com.focus.gate.dto.StatisticsView;
import com.focus.gate.engine.cache.DecisionCache;
import com.focus.gate.engine.classifier.Prediction;
import com.focus.gate.engine.classifier.ProductivityClassifier;
import com.focus.gate.engine.feature.FeatureExtractor;
import com.focus.gate.engine.feature.FeatureVector;
import com.focus.gate.engine.feature.UrlParts;
import com.focus.gate.engine.lookup.BoundedMetadataLookup;
import com.focus.gate.engine.mission.Mission;
import com.focus.gate.engine.rules.RuleContext;
import com.focus.gate.engine.rules.RuleOutcome;
import com.focus.gate.engine.rules.RuleTier;
import com.focus.gate.engine.store.DecisionStatistics;
import com.focus.gate.engine.store.DecisionStore;
import com.focus.gate.model.AdmissionAction;
import com.focus.gate.model.StatisticsSnapshot;
import com.focus.gate.service.MissionService;
import com.focus.gate.service.NotificationService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Admission decisions for the interception point.
 *
 * <ul>
 *   <li>{@link #decide(String)}: cache, then rule tier. Table lookups only, never blocks
 *       and never touches storage.</li>
 *   <li>{@link #decideWithMetadata(PageMetadata)}: rule tier with page text, then cache,
 *       then the classifier. Classifier decisions are persisted before returning.</li>
 * </ul>
 *
 * <p>Cache and statistics share one lock. Unexpected failures answer ALLOW.
 */
@Service
@Slf4j
public class DecisionEngine {

    private final RuleTier ruleTier;
    private final ProductivityClassifier classifier;
    private final FeatureExtractor featureExtractor;
    private final BoundedMetadataLookup metadataLookup;
    private final DecisionStore store;
    private final MissionService missionService;
    private final NotificationService notifications;
    private final Clock clock;
    private final int statsFlushEvery;

    private final Object lock = new Object();
    private final DecisionCache cache;
    private final DecisionStatistics statistics;

    public DecisionEngine(RuleTier ruleTier,
                          ProductivityClassifier classifier,
                          FeatureExtractor featureExtractor,
                          BoundedMetadataLookup metadataLookup,
                          DecisionStore store,
                          MissionService missionService,
                          NotificationService notifications,
                          Clock clock,
                          @Value("${focus.engine.cache-ttl:300s}") Duration cacheTtl,
                          @Value("${focus.engine.stats-flush-every:100}") int statsFlushEvery) {
        this.ruleTier = ruleTier;
        this.classifier = classifier;
        this.featureExtractor = featureExtractor;
        this.metadataLookup = metadataLookup;
        this.store = store;
        this.missionService = missionService;
        this.notifications = notifications;
        this.clock = clock;
        this.statsFlushEvery = Math.max(1, statsFlushEvery);
        this.cache = new DecisionCache(clock, cacheTtl);
        this.statistics = store.loadStatistics()
                .map(DecisionStatistics::restore)
                .orElseGet(DecisionStatistics::new);
    }

    public AdmissionVerdict decide(String url) {
        try {
            synchronized (lock) {
                Optional<AdmissionVerdict> cached = cache.get(url);
                if (cached.isPresent()) {
                    statistics.recordCacheHit();
                    return cached.get().fromCache();
                }
            }

            Optional<Mission> mission = missionService.current();
            RuleOutcome outcome = ruleTier.evaluate(new RuleContext(UrlParts.parse(url), mission, ""));
            return fastPathVerdict(url, outcome);
        } catch (RuntimeException e) {
            return failOpen(url, e);
        }
    }

    public AdmissionVerdict decideWithMetadata(PageMetadata metadata) {
        String url = metadata.url();
        try {
            Optional<Mission> mission = missionService.current();
            RuleOutcome outcome = ruleTier.evaluate(
                    new RuleContext(UrlParts.parse(url), mission, metadata.alignmentText()));
            if (!outcome.isDefault()) {
                return fastPathVerdict(url, outcome);
            }

            synchronized (lock) {
                Optional<AdmissionVerdict> cached = cache.get(url);
                if (cached.isPresent()) {
                    statistics.recordCacheHit();
                    return cached.get().fromCache();
                }
            }

            if (mission.isEmpty()) {
                log.info("No mission loaded, url={} falls back to rule={}", url, outcome.ruleId());
                return fastPathVerdict(url, outcome);
            }
            return classify(metadata, mission.get());
        } catch (RuntimeException e) {
            return failOpen(url, e);
        }
    }

    private AdmissionVerdict classify(PageMetadata supplied, Mission mission) {
        PageMetadata metadata = supplied.sparse() ? metadataLookup.enrich(supplied) : supplied;
        FeatureVector features = featureExtractor.extract(metadata, mission);
        Prediction prediction = classifier.predict(features);

        log.info("{} url={} domain={} title='{}' probability={}",
                prediction.action(), metadata.url(), UrlParts.parse(metadata.url()).domain(),
                abbreviate(metadata.title()), String.format("%.3f", prediction.probability()));

        store.record(metadata.url(), mission, features, prediction.action(), prediction.probability());

        AdmissionVerdict verdict = new AdmissionVerdict(metadata.url(), prediction.action(),
                prediction.probability(), AdmissionVerdict.SOURCE_CLASSIFIER, false);
        synchronized (lock) {
            statistics.recordSlowPath();
            cache.put(metadata.url(), verdict);
        }
        publishIfBlocked(verdict);
        return verdict;
    }

    private AdmissionVerdict fastPathVerdict(String url, RuleOutcome outcome) {
        AdmissionVerdict verdict = new AdmissionVerdict(url, outcome.action(), 1.0, outcome.ruleId(), false);
        synchronized (lock) {
            statistics.recordFastPath();
            cache.put(url, verdict);
        }
        publishIfBlocked(verdict);
        return verdict;
    }

    private AdmissionVerdict failOpen(String url, RuntimeException e) {
        log.error("Decision for url={} failed, allowing: {}", url, e.getMessage(), e);
        return new AdmissionVerdict(url, AdmissionAction.ALLOW, 0.0, AdmissionVerdict.SOURCE_FAIL_OPEN, false);
    }

    private void publishIfBlocked(AdmissionVerdict verdict) {
        if (!verdict.allowed()) {
            notifications.broadcastBlocked(verdict);
        }
    }

    public boolean submitFeedback(String url, boolean correct) {
        Optional<Mission> mission = missionService.current();
        if (mission.isEmpty()) {
            log.warn("Feedback for url={} ignored, no mission loaded", url);
            return false;
        }
        if (store.applyFeedback(url, mission.get(), correct).isEmpty()) {
            return false;
        }

        StatisticsSnapshot snapshot = null;
        synchronized (lock) {
            long feedbackCount = statistics.recordFeedback(correct);
            if (feedbackCount % statsFlushEvery == 0) {
                snapshot = statistics.snapshot(clock.instant());
            }
        }
        log.info("Feedback url={} correct={}", url, correct);
        if (snapshot != null) {
            store.saveStatistics(snapshot);
        }
        return true;
    }

    public void clearCache() {
        synchronized (lock) {
            cache.clear();
        }
        log.info("Decision cache cleared");
    }

    public StatisticsView statistics() {
        String missionText = missionService.current().map(Mission::text).orElse(null);
        synchronized (lock) {
            return new StatisticsView(
                    missionText,
                    statistics.totalDecisions(),
                    statistics.cacheHits(),
                    statistics.fastPathDecisions(),
                    statistics.feedbackCount(),
                    statistics.correctDecisions(),
                    statistics.accuracy(),
                    statistics.cacheHitRate(),
                    statistics.fastPathRate(),
                    classifier.threshold(),
                    cache.size(),
                    classifier.trained());
        }
    }

    @PreDestroy
    public void flushStatistics() {
        StatisticsSnapshot snapshot;
        synchronized (lock) {
            snapshot = statistics.snapshot(clock.instant());
        }
        store.saveStatistics(snapshot);
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50);
    }
}
