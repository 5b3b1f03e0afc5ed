package com.focus.gate.dto;

import com.focus.gate.model.SessionState;

import java.time.Duration;
import java.time.Instant;

public record SessionStatusView(
        boolean active,
        SessionState state,
        SessionState lastOutcome,
        String task,
        Instant endTime,
        Duration remaining
) {

    public static SessionStatusView idle(SessionState state, SessionState lastOutcome) {
        return new SessionStatusView(false, state, lastOutcome, null, null, Duration.ZERO);
    }
}
