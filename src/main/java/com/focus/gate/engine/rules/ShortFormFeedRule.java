package com.focus.gate.engine.rules;

import com.focus.gate.engine.rules.AdmissionRule.RuleResult;

public class ShortFormFeedRule implements AdmissionRule {

    @Override
    public String ruleId() {
        return "short-form-feed";
    }

    @Override
    public RuleResult evaluate(RuleContext context) {
        if (context.domain().contains(DomainCatalog.VIDEO_PLATFORM)
                && context.urlContainsAny(DomainCatalog.SHORT_FORM_MARKERS)) {
            return RuleResult.block("short-form video");
        }
        if (context.urlContainsAny(DomainCatalog.SHORT_FORM_PATTERNS)) {
            return RuleResult.block("short-form feed");
        }
        return RuleResult.pass();
    }
}
