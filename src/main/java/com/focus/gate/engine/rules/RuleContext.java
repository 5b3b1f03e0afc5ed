package com.focus.gate.engine.rules;

import com.focus.gate.engine.feature.UrlParts;
import com.focus.gate.engine.mission.Mission;

import java.util.Optional;

public record RuleContext(UrlParts url, Optional<Mission> mission, String pageText) {

    public RuleContext {
        mission = mission == null ? Optional.empty() : mission;
        pageText = pageText == null ? "" : pageText;
    }

    public static RuleContext of(String url, Mission mission) {
        return new RuleContext(UrlParts.parse(url), Optional.ofNullable(mission), "");
    }

    public String lower() {
        return url.lower();
    }

    public String domain() {
        return url.domain();
    }

    public boolean urlContainsAny(Iterable<String> fragments) {
        for (String fragment : fragments) {
            if (url.lower().contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
