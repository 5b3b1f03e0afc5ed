package com.focus.gate.dto;

import com.focus.gate.model.AdmissionAction;

public record AdmissionVerdict(
        String url,
        AdmissionAction action,
        double confidence,
        String source,
        boolean cached
) {

    public static final String SOURCE_CLASSIFIER = "classifier";
    public static final String SOURCE_FAIL_OPEN = "fail-open";

    public boolean allowed() {
        return action.allowed();
    }

    public AdmissionVerdict fromCache() {
        return new AdmissionVerdict(url, action, confidence, source, true);
    }
}
