package com.focus.gate.engine.classifier;

import com.focus.gate.model.AdmissionAction;

public record Prediction(double probability, AdmissionAction action) {}
