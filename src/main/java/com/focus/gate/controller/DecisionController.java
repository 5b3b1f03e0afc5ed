package com.focus.gate.controller;

import com.focus.gate.dto.AdmissionVerdict;
import com.focus.gate.dto.FeedbackRequest;
import com.focus.gate.dto.PageMetadata;
import com.focus.gate.engine.DecisionEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DecisionController {

    private final DecisionEngine decisionEngine;

    @GetMapping("/decide")
    public ResponseEntity<AdmissionVerdict> decide(@RequestParam String url) {
        return ResponseEntity.ok(decisionEngine.decide(url));
    }

    @PostMapping("/decide")
    public ResponseEntity<AdmissionVerdict> decideWithMetadata(@Valid @RequestBody PageMetadata metadata) {
        return ResponseEntity.ok(decisionEngine.decideWithMetadata(metadata));
    }

    @PostMapping("/feedback")
    public ResponseEntity<Map<String, Object>> feedback(@Valid @RequestBody FeedbackRequest request) {
        boolean updated = decisionEngine.submitFeedback(request.url(), request.correct());
        return ResponseEntity.ok(Map.of("url", request.url(), "updated", updated));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        decisionEngine.clearCache();
        return ResponseEntity.noContent().build();
    }
}
