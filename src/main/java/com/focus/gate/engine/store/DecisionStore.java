package com.focus.gate.engine.store;

import com.focus.gate.engine.feature.FeatureVector;
import com.focus.gate.engine.mission.Mission;
import com.focus.gate.model.AdmissionAction;
import com.focus.gate.model.DecisionRecord;
import com.focus.gate.model.StatisticsSnapshot;
import com.focus.gate.repository.DecisionRecordRepository;
import com.focus.gate.repository.StatisticsSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class DecisionStore {

    private final DecisionRecordRepository decisionRepository;
    private final StatisticsSnapshotRepository statisticsRepository;
    private final Clock clock;

    private final Object feedbackLock = new Object();

    public static String missionHash(Mission mission) {
        return DigestUtils.sha256Hex(mission.text());
    }

    public Optional<DecisionRecord> record(String url, Mission mission, FeatureVector features,
                                           AdmissionAction action, double confidence) {
        DecisionRecord record = DecisionRecord.builder()
                .url(url)
                .mission(mission.text())
                .missionHash(missionHash(mission))
                .features(features.toBytes())
                .featureLayout(FeatureVector.LAYOUT_VERSION)
                .action(action)
                .confidence(confidence)
                .decidedAt(clock.instant())
                .build();
        try {
            return Optional.of(decisionRepository.save(record));
        } catch (DataAccessException | TransactionException e) {
            log.warn("Decision for url={} not recorded, store unavailable: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Attaches feedback to the most recent decision for (url, mission) that has none yet.
     * Reward is +1 for a correct decision and -1 otherwise. Lookup and update run under
     * one lock so two feedback calls never claim the same record.
     */
    public Optional<DecisionRecord> applyFeedback(String url, Mission mission, boolean correct) {
        synchronized (feedbackLock) {
            try {
                Optional<DecisionRecord> latest = decisionRepository
                        .findFirstByUrlAndMissionHashAndCorrectIsNullOrderByDecidedAtDescIdDesc(url, missionHash(mission));
                if (latest.isEmpty()) {
                    log.debug("No decision awaiting feedback for url={}", url);
                    return Optional.empty();
                }
                DecisionRecord record = latest.get();
                record.setCorrect(correct);
                record.setReward(correct ? 1.0 : -1.0);
                return Optional.of(decisionRepository.save(record));
            } catch (DataAccessException | TransactionException e) {
                log.warn("Feedback for url={} not recorded, store unavailable: {}", url, e.getMessage());
                return Optional.empty();
            }
        }
    }

    public Optional<StatisticsSnapshot> loadStatistics() {
        try {
            return statisticsRepository.findById(StatisticsSnapshot.SINGLETON_ID);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Could not load statistics snapshot: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void saveStatistics(StatisticsSnapshot snapshot) {
        try {
            statisticsRepository.save(snapshot);
            log.debug("Statistics flushed: total={} feedback={}", snapshot.getTotalDecisions(), snapshot.getFeedbackCount());
        } catch (DataAccessException | TransactionException e) {
            log.warn("Statistics snapshot not saved: {}", e.getMessage());
        }
    }
}
