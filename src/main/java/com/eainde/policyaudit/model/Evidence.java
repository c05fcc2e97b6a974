package com.eainde.policyaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A source page plus the text that supports one side of a finding.
 *
 * @param page    1-based page of the source rule
 * @param snippet whitespace-collapsed excerpt of the source rule
 */
public record Evidence(
        @JsonProperty("page")    int page,
        @JsonProperty("snippet") String snippet
) {

    public Evidence {
        if (page < 1) {
            throw new EvidenceIntegrityException("Evidence page must be >= 1 but was " + page);
        }
        if (snippet == null || snippet.isBlank()) {
            throw new EvidenceIntegrityException("Evidence snippet is missing for page " + page);
        }
    }

    public static Evidence of(Rule rule) {
        return new Evidence(rule.sourcePage(), rule.evidenceSnippet());
    }
}
