package com.eainde.policyaudit.normalize;

import com.eainde.policyaudit.model.CoverageCondition;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Picks up access conditions such as pre-authorization or referral requirements. */
public class CoverageConditionExtractor {

    private static final Map<CoverageCondition, Pattern> PATTERNS = Map.of(
            CoverageCondition.PRE_AUTHORIZATION, Pattern.compile(
                    "(?i)\\bpre[-\\s]?auth(?:ori[sz]ation|ori[sz]ed)?\\b"),
            CoverageCondition.PRIOR_APPROVAL, Pattern.compile(
                    "(?i)\\bprior\\s+approval\\b"),
            CoverageCondition.REFERRAL, Pattern.compile(
                    "(?i)(?<!county\\s)(?<!national\\s)(?<!no\\s)\\breferr(?:al|ed)\\b(?!\\s+hospitals?)"),
            CoverageCondition.CO_PAYMENT, Pattern.compile(
                    "(?i)(?<!no\\s)\\bco-?\\s?pay(?:ments?)?\\b"));

    public Set<CoverageCondition> extract(String rawText) {
        Set<CoverageCondition> conditions = EnumSet.noneOf(CoverageCondition.class);
        if (rawText == null || rawText.isBlank()) {
            return conditions;
        }
        PATTERNS.forEach((condition, pattern) -> {
            if (pattern.matcher(rawText).find()) {
                conditions.add(condition);
            }
        });
        return conditions;
    }
}
