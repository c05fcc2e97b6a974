package com.eainde.policyaudit.model;

public enum InsightStatus {
    NEW,
    RECURRING
}
