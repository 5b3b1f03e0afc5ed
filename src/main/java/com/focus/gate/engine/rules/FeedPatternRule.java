package com.focus.gate.engine.rules;

import com.focus.gate.engine.rules.AdmissionRule.RuleResult;

public class FeedPatternRule implements AdmissionRule {

    @Override
    public String ruleId() {
        return "feed-pattern";
    }

    @Override
    public RuleResult evaluate(RuleContext context) {
        if (context.urlContainsAny(DomainCatalog.FEED_URL_PATTERNS)) {
            return RuleResult.block("platform feed");
        }
        if (context.urlContainsAny(DomainCatalog.FEED_PATH_PATTERNS)) {
            return RuleResult.block("feed path");
        }
        return RuleResult.pass();
    }
}
