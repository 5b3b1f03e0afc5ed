package com.focus.gate.engine.store;

import com.focus.gate.model.StatisticsSnapshot;

import java.time.Instant;

public class DecisionStatistics {

    private long totalDecisions;
    private long cacheHits;
    private long fastPathDecisions;
    private long feedbackCount;
    private long correctDecisions;

    public static DecisionStatistics restore(StatisticsSnapshot snapshot) {
        DecisionStatistics stats = new DecisionStatistics();
        stats.totalDecisions = snapshot.getTotalDecisions();
        stats.cacheHits = snapshot.getCacheHits();
        stats.fastPathDecisions = snapshot.getFastPathDecisions();
        stats.feedbackCount = snapshot.getFeedbackCount();
        stats.correctDecisions = snapshot.getCorrectDecisions();
        return stats;
    }

    public void recordCacheHit() {
        totalDecisions++;
        cacheHits++;
    }

    public void recordFastPath() {
        totalDecisions++;
        fastPathDecisions++;
    }

    public void recordSlowPath() {
        totalDecisions++;
    }

    public long recordFeedback(boolean correct) {
        feedbackCount++;
        if (correct) {
            correctDecisions++;
        }
        return feedbackCount;
    }

    public long totalDecisions() {
        return totalDecisions;
    }

    public long cacheHits() {
        return cacheHits;
    }

    public long fastPathDecisions() {
        return fastPathDecisions;
    }

    public long feedbackCount() {
        return feedbackCount;
    }

    public long correctDecisions() {
        return correctDecisions;
    }

    public double accuracy() {
        return ratio(correctDecisions, feedbackCount);
    }

    public double cacheHitRate() {
        return ratio(cacheHits, totalDecisions);
    }

    public double fastPathRate() {
        return ratio(fastPathDecisions, totalDecisions);
    }

    public StatisticsSnapshot snapshot(Instant now) {
        return StatisticsSnapshot.builder()
                .id(StatisticsSnapshot.SINGLETON_ID)
                .totalDecisions(totalDecisions)
                .cacheHits(cacheHits)
                .fastPathDecisions(fastPathDecisions)
                .feedbackCount(feedbackCount)
                .correctDecisions(correctDecisions)
                .updatedAt(now)
                .build();
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
