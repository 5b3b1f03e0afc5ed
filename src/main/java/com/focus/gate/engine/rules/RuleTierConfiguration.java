package com.focus.gate.engine.rules;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class RuleTierConfiguration {

    @Value("${focus.rules.extra-educational-domains:}")
    private List<String> extraEducationalDomains;

    @Value("${focus.rules.extra-blocked-domains:}")
    private List<String> extraBlockedDomains;

    /**
     * Priority order:
     * 1. short-form feeds (block, before any allow rule)
     * 2. infrastructure and static assets (allow)
     * 3. educational domains, including the mission's own (allow)
     * 4. distraction domains (block)
     * 5. feed/home/explore/stories paths (block)
     * 6. video watch endpoints (mission alignment)
     * 7. search engines (allow)
     * 8. default (allow)
     */
    @Bean
    public RuleTier ruleTier() {
        return ruleTierWith(extraEducationalDomains, extraBlockedDomains);
    }

    RuleTier ruleTierWith(List<String> educationalDomains, List<String> blockedDomains) {
        return new RuleTier(List.of(
                new ShortFormFeedRule(),
                new InfrastructureRule(),
                new EducationalDomainRule(educationalDomains),
                new DistractionDomainRule(blockedDomains),
                new FeedPatternRule(),
                new WatchEndpointRule(),
                new SearchEngineRule(),
                new DefaultAllowRule()
        ));
    }
}
