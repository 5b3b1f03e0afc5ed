package com.focus.gate.engine.cache;

import com.focus.gate.dto.AdmissionVerdict;

import java.time.Instant;

public record CachedDecision(AdmissionVerdict verdict, Instant storedAt) {}
