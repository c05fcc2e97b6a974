package com.eainde.policyaudit.model;

public enum ContradictionType {
    TARIFF,
    LIMIT,
    COVERAGE,
    FACILITY_EXCLUSION
}
