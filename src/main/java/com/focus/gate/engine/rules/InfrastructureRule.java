package com.focus.gate.engine.rules;

import com.focus.gate.engine.rules.AdmissionRule.RuleResult;

public class InfrastructureRule implements AdmissionRule {

    @Override
    public String ruleId() {
        return "infrastructure";
    }

    @Override
    public RuleResult evaluate(RuleContext context) {
        if (DomainCatalog.INFRASTRUCTURE.contains(context.domain())
                || context.urlContainsAny(DomainCatalog.INFRASTRUCTURE)) {
            return RuleResult.allow("infrastructure or static assets");
        }
        return RuleResult.pass();
    }
}
