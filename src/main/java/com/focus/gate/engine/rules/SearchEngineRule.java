package com.focus.gate.engine.rules;

import com.focus.gate.engine.rules.AdmissionRule.RuleResult;

public class SearchEngineRule implements AdmissionRule {

    @Override
    public String ruleId() {
        return "search-engine";
    }

    @Override
    public RuleResult evaluate(RuleContext context) {
        return DomainCatalog.SEARCH_ENGINES.contains(context.domain())
                ? RuleResult.allow("search engine")
                : RuleResult.pass();
    }
}
