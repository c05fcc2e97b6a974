package com.eainde.policyaudit.model;

public enum CoverageStatus {
    INCLUDED,
    EXCLUDED
}
