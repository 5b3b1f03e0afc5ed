package com.focus.gate.engine.rules;

import com.focus.gate.engine.rules.AdmissionRule.RuleResult;

import java.util.List;
import java.util.Set;

public class DistractionDomainRule implements AdmissionRule {

    private final Set<String> domains;

    public DistractionDomainRule(List<String> extraDomains) {
        this.domains = DomainCatalog.merge(DomainCatalog.DISTRACTION, extraDomains);
    }

    @Override
    public String ruleId() {
        return "distraction-domain";
    }

    @Override
    public RuleResult evaluate(RuleContext context) {
        for (String domain : domains) {
            if (context.url().domainMatches(domain)) {
                return RuleResult.block("distraction domain " + domain);
            }
        }
        return RuleResult.pass();
    }
}
