package com.focus.gate.dto;

import java.time.Instant;
import java.util.List;

public record SessionStartResult(
        String secret,
        List<String> fragments,
        Instant endTime
) {}
