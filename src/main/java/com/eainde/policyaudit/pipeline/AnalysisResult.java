package com.eainde.policyaudit.pipeline;

import com.eainde.policyaudit.insight.InsightSummary;
import com.eainde.policyaudit.model.ContradictionRow;
import com.eainde.policyaudit.model.GapRow;
import com.eainde.policyaudit.model.Rule;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything one run produced.
 *
 * @param rules          normalized rules with their service keys
 * @param contradictions flagged contradictions, scored and deduplicated
 * @param gaps           one row per expected condition
 * @param summary        deduplication counts of the run
 */
public record AnalysisResult(
        @JsonProperty("rules")          List<Rule> rules,
        @JsonProperty("contradictions") List<ContradictionRow> contradictions,
        @JsonProperty("gaps")           List<GapRow> gaps,
        @JsonProperty("summary")        InsightSummary summary
) {

    public AnalysisResult {
        rules = List.copyOf(rules);
        contradictions = List.copyOf(contradictions);
        gaps = List.copyOf(gaps);
    }
}
