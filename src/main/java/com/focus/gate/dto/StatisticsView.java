package com.focus.gate.dto;

public record StatisticsView(
        String mission,
        long totalDecisions,
        long cacheHits,
        long fastPathDecisions,
        long feedbackCount,
        long correctDecisions,
        double accuracy,
        double cacheHitRate,
        double fastPathRate,
        double decisionThreshold,
        int cacheSize,
        boolean modelTrained
) {}
