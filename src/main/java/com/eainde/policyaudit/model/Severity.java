package com.eainde.policyaudit.model;

public enum Severity {
    HIGH,
    MEDIUM
}
