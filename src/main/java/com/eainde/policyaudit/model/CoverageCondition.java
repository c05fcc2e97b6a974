package com.eainde.policyaudit.model;

/** Access conditions attached to a covered service. */
public enum CoverageCondition {
    PRE_AUTHORIZATION,
    REFERRAL,
    CO_PAYMENT,
    PRIOR_APPROVAL
}
