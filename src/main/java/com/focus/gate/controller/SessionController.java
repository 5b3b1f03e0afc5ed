package com.focus.gate.controller;

import com.focus.gate.dto.EndSessionRequest;
import com.focus.gate.dto.SessionStartResult;
import com.focus.gate.dto.SessionStatusView;
import com.focus.gate.dto.StartSessionRequest;
import com.focus.gate.session.SessionSupervisor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
public class SessionController {

    private final SessionSupervisor sessionSupervisor;

    @GetMapping
    public ResponseEntity<SessionStatusView> status() {
        return ResponseEntity.ok(sessionSupervisor.status());
    }

    @PostMapping("/start")
    public ResponseEntity<SessionStartResult> start(@Valid @RequestBody StartSessionRequest request) {
        SessionStartResult result = sessionSupervisor.startSession(request.durationHours(), request.task());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/end")
    public ResponseEntity<Map<String, Object>> end(@Valid @RequestBody EndSessionRequest request) {
        if (sessionSupervisor.endSession(request.secret())) {
            return ResponseEntity.ok(Map.of("ended", true, "state", sessionSupervisor.status().lastOutcome()));
        }
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("ended", false));
    }
}
