package com.focus.gate.controller;

import com.focus.gate.dto.StatisticsView;
import com.focus.gate.engine.DecisionEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final DecisionEngine decisionEngine;

    @GetMapping
    public ResponseEntity<StatisticsView> getMetrics() {
        return ResponseEntity.ok(decisionEngine.statistics());
    }
}
