package com.eainde.policyaudit.model;

/**
 * Coverage status of an expected condition, ordered from worst to best.
 */
public enum GapStatus {
    NO_COVERAGE_FOUND,
    MINIMAL_COVERAGE,
    ADEQUATE;

    public boolean isActionable() {
        return this != ADEQUATE;
    }
}
