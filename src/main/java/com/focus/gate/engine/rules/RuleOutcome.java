package com.focus.gate.engine.rules;

import com.focus.gate.model.AdmissionAction;

public record RuleOutcome(AdmissionAction action, String ruleId, String reason) {

    public boolean isDefault() {
        return DefaultAllowRule.RULE_ID.equals(ruleId);
    }
}
