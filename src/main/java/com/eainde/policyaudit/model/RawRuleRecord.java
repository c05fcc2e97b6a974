package com.eainde.policyaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One row handed over by the upstream text/table extractor.
 *
 * <p>The candidate lists are hints only; the normalizer re-reads {@code rawText}
 * to locate amounts and units by position. Any list may be empty.</p>
 *
 * @param rawText                   the full text of the source row or sentence
 * @param candidateAmounts          amount strings the extractor noticed ("KES 10,650")
 * @param candidateUnits            unit phrases the extractor noticed ("per session")
 * @param candidateFacilityMentions facility phrases ("Level 4-6", "dispensary")
 * @param candidateLimitPhrases     limit phrases ("3 sessions per week")
 * @param pageIndex                 1-based source page
 * @param serviceText               service description cell when the extractor has one, else null
 * @param categoryHint              category suggested by the extractor, else null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawRuleRecord(
        @JsonProperty("raw_text")                    String rawText,
        @JsonProperty("candidate_amounts")           List<String> candidateAmounts,
        @JsonProperty("candidate_units")             List<String> candidateUnits,
        @JsonProperty("candidate_facility_mentions") List<String> candidateFacilityMentions,
        @JsonProperty("candidate_limit_phrases")     List<String> candidateLimitPhrases,
        @JsonProperty("page_index")                  int pageIndex,
        @JsonProperty("service_text")                String serviceText,
        @JsonProperty("category_hint")               String categoryHint
) {

    public RawRuleRecord {
        rawText = rawText == null ? "" : rawText;
        candidateAmounts = candidateAmounts == null ? List.of() : List.copyOf(candidateAmounts);
        candidateUnits = candidateUnits == null ? List.of() : List.copyOf(candidateUnits);
        candidateFacilityMentions = candidateFacilityMentions == null
                ? List.of() : List.copyOf(candidateFacilityMentions);
        candidateLimitPhrases = candidateLimitPhrases == null ? List.of() : List.copyOf(candidateLimitPhrases);
    }

    /** Convenience for rows that carry nothing but text. */
    public static RawRuleRecord ofText(String rawText, int pageIndex) {
        return new RawRuleRecord(rawText, List.of(), List.of(), List.of(), List.of(), pageIndex, null, null);
    }
}
