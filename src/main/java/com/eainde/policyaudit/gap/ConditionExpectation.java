package com.eainde.policyaudit.gap;

import com.eainde.policyaudit.model.RiskLevel;

import java.util.List;

/**
 * One validated expectation: a condition plus the services that count as covering it.
 *
 * @param condition condition name, as written in the mapping
 * @param keywords  lower-cased, non-blank keywords
 * @param riskLevel clinical risk of leaving the condition uncovered
 * @param notes     free text carried into reports, may be null
 */
public record ConditionExpectation(String condition, List<String> keywords, RiskLevel riskLevel, String notes) {

    public ConditionExpectation {
        keywords = List.copyOf(keywords);
    }
}
