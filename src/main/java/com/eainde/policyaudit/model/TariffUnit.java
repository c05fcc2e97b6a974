package com.eainde.policyaudit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Billing unit a tariff amount applies to.
 *
 * <p>{@link #UNSPECIFIED} is a sentinel: an amount without a unit phrase in its own
 * sentence stays unspecified and is never compared against a concrete unit.</p>
 */
public enum TariffUnit {

    PER_SESSION("per_session"),
    PER_DAY("per_day"),
    PER_MONTH("per_month"),
    PER_YEAR("per_year"),
    PER_VISIT("per_visit"),
    UNSPECIFIED("unspecified");

    private final String label;

    TariffUnit(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isSpecified() {
        return this != UNSPECIFIED;
    }
}
