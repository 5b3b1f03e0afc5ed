package com.focus.gate.dto;

import jakarta.validation.constraints.NotBlank;

public record EndSessionRequest(
        @NotBlank String secret
) {}
