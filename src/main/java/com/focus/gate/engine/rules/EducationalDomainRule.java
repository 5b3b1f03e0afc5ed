package com.focus.gate.engine.rules;

import com.focus.gate.engine.mission.Mission;
import com.focus.gate.engine.rules.AdmissionRule.RuleResult;

import java.util.List;
import java.util.Set;

public class EducationalDomainRule implements AdmissionRule {

    private final Set<String> domains;

    public EducationalDomainRule(List<String> extraDomains) {
        this.domains = DomainCatalog.merge(DomainCatalog.EDUCATIONAL, extraDomains);
    }

    @Override
    public String ruleId() {
        return "educational-domain";
    }

    @Override
    public RuleResult evaluate(RuleContext context) {
        for (String domain : domains) {
            if (context.url().domainMatches(domain)) {
                return RuleResult.allow("educational domain " + domain);
            }
        }
        List<String> missionDomains = context.mission().map(Mission::allowedDomains).orElse(List.of());
        for (String domain : missionDomains) {
            if (context.url().domainMatches(domain)) {
                return RuleResult.allow("mission domain " + domain);
            }
        }
        return RuleResult.pass();
    }
}
