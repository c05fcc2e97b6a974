package com.eainde.policyaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Coverage assessment of one expected condition.
 *
 * @param condition        condition name from the expectation mapping
 * @param expectedKeywords keywords that count as coverage
 * @param status           coverage status
 * @param riskLevel        configured clinical risk of leaving the condition uncovered
 * @param evidence         matched snippets prefixed with their page, or "no matches found"
 * @param matchedPages     pages of the matching rules
 * @param searchedRuleCount number of rules inspected
 * @param weakestMatch     weakest extraction confidence among the matching rules, null without matches
 * @param recommendation   suggested follow-up, null when adequate
 * @param confidenceTier   tier assigned by the scorer, null until scored
 */
public record Gap(
        @JsonProperty("condition")           String condition,
        @JsonProperty("expected_keywords")   List<String> expectedKeywords,
        @JsonProperty("status")              GapStatus status,
        @JsonProperty("risk_level")          RiskLevel riskLevel,
        @JsonProperty("evidence")            List<String> evidence,
        @JsonProperty("matched_pages")       List<Integer> matchedPages,
        @JsonProperty("searched_rule_count") int searchedRuleCount,
        @JsonProperty("weakest_match")       ConfidenceTier weakestMatch,
        @JsonProperty("recommendation")      String recommendation,
        @JsonProperty("confidence_tier")     ConfidenceTier confidenceTier
) {

    public static final String NO_MATCHES = "no matches found";

    public Gap {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(status, "status");
        expectedKeywords = expectedKeywords == null ? List.of() : List.copyOf(expectedKeywords);
        evidence = evidence == null || evidence.isEmpty() ? List.of(NO_MATCHES) : List.copyOf(evidence);
        matchedPages = matchedPages == null ? List.of() : List.copyOf(matchedPages);
    }

    public int matchCount() {
        return matchedPages.size();
    }

    public Gap withConfidenceTier(ConfidenceTier tier) {
        return new Gap(condition, expectedKeywords, status, riskLevel, evidence, matchedPages,
                searchedRuleCount, weakestMatch, recommendation, tier);
    }
}
