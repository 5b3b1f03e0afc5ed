package com.focus.gate.engine.rules;

import com.focus.gate.engine.rules.AdmissionRule.RuleResult;
import com.focus.gate.model.AdmissionAction;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class RuleTier {

    private final List<AdmissionRule> rules;

    public RuleTier(List<AdmissionRule> rules) {
        if (rules.isEmpty() || !(rules.get(rules.size() - 1) instanceof DefaultAllowRule)) {
            throw new IllegalArgumentException("Rule tier must end with the default rule");
        }
        this.rules = List.copyOf(rules);
    }

    public RuleOutcome evaluate(RuleContext context) {
        for (AdmissionRule rule : rules) {
            RuleResult result;
            try {
                result = rule.evaluate(context);
            } catch (RuntimeException e) {
                log.warn("Rule {} failed for url={}, skipping: {}", rule.ruleId(), context.url().raw(), e.getMessage());
                continue;
            }
            if (result instanceof RuleResult.Match match) {
                log.info("{} url={} rule={} reason={}",
                        match.action(), context.url().raw(), rule.ruleId(), match.reason());
                return new RuleOutcome(match.action(), rule.ruleId(), match.reason());
            }
        }
        // unreachable while the default rule is last
        return new RuleOutcome(AdmissionAction.ALLOW, DefaultAllowRule.RULE_ID, "no rule matched");
    }

    public List<String> ruleIds() {
        return rules.stream().map(AdmissionRule::ruleId).toList();
    }
}
