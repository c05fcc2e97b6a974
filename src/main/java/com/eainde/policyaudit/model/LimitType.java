package com.eainde.policyaudit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Frequency window of a utilization limit. */
public enum LimitType {

    PER_WEEK("per_week"),
    PER_MONTH("per_month"),
    PER_YEAR("per_year"),
    MAX_TOTAL("max_total");

    private final String label;

    LimitType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
