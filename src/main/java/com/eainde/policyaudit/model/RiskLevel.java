package com.eainde.policyaudit.model;

public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW
}
