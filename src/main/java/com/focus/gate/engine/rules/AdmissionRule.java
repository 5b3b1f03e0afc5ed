package com.focus.gate.engine.rules;

import com.focus.gate.model.AdmissionAction;

public interface AdmissionRule {

    String ruleId();

    RuleResult evaluate(RuleContext context);

    sealed interface RuleResult {
        record Match(AdmissionAction action, String reason) implements RuleResult {}
        record Pass() implements RuleResult {}

        static RuleResult allow(String reason) {
            return new Match(AdmissionAction.ALLOW, reason);
        }

        static RuleResult block(String reason) {
            return new Match(AdmissionAction.BLOCK, reason);
        }

        static RuleResult pass() {
            return new Pass();
        }
    }
}
