package com.focus.gate.dto;

import com.focus.gate.model.SessionState;

import java.time.Instant;

public record SessionEvent(
        String event,
        String task,
        SessionState state,
        Instant endTime,
        Instant at
) {}
