package com.focus.gate.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MissionDocument(
        @JsonProperty("mission") @JsonAlias("missionText") String mission,
        @JsonProperty("allowed_domains") @JsonAlias("allowedDomains") List<String> allowedDomains,
        @JsonProperty("allowed_keywords") @JsonAlias("allowedKeywords") List<String> allowedKeywords
) {

    public MissionDocument {
        allowedDomains = allowedDomains == null ? List.of() : List.copyOf(allowedDomains);
        allowedKeywords = allowedKeywords == null ? List.of() : List.copyOf(allowedKeywords);
    }
}
