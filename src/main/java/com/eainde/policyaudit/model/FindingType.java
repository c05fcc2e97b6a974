package com.eainde.policyaudit.model;

/** Kind of finding tracked by the insight store. */
public enum FindingType {
    CONTRADICTION,
    GAP
}
