package com.focus.gate.engine.rules;

import com.focus.gate.engine.rules.AdmissionRule.RuleResult;

public class DefaultAllowRule implements AdmissionRule {

    public static final String RULE_ID = "default";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public RuleResult evaluate(RuleContext context) {
        return RuleResult.allow("no rule matched");
    }
}
