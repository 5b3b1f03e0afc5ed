package com.focus.gate.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record StartSessionRequest(
        @Positive double durationHours,
        @NotBlank String task
) {}
