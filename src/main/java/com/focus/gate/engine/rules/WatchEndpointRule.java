package com.focus.gate.engine.rules;

import com.focus.gate.engine.rules.AdmissionRule.RuleResult;

public class WatchEndpointRule implements AdmissionRule {

    @Override
    public String ruleId() {
        return "watch-endpoint";
    }

    @Override
    public RuleResult evaluate(RuleContext context) {
        if (!context.domain().contains(DomainCatalog.VIDEO_PLATFORM)) {
            return RuleResult.pass();
        }
        if (context.urlContainsAny(DomainCatalog.WATCH_EDUCATIONAL_KEYWORDS)) {
            return RuleResult.allow("educational video");
        }
        if (!context.urlContainsAny(DomainCatalog.WATCH_ENDPOINTS)) {
            return RuleResult.allow("video platform page");
        }
        if (context.pageText().isBlank()) {
            return RuleResult.allow("no page text to check alignment");
        }
        boolean aligned = context.mission()
                .map(m -> m.alignsWith(context.pageText()))
                .orElse(true);
        return aligned
                ? RuleResult.allow("video aligned with mission")
                : RuleResult.block("video not aligned with mission");
    }
}
