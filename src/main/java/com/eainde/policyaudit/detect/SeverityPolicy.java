package com.eainde.policyaudit.detect;

import com.eainde.policyaudit.model.ServiceCategory;
import com.eainde.policyaudit.model.Severity;

import java.util.Locale;

/**
 * HIGH when the disagreement is large or the service is clinically high risk, MEDIUM otherwise.
 * Coverage and facility conflicts are total disagreements and pass a spread of 1.0.
 */
public class SeverityPolicy {

    static final double TOTAL_DISAGREEMENT = 1.0;

    private final DetectionSettings settings;

    public SeverityPolicy(DetectionSettings settings) {
        this.settings = settings;
    }

    public Severity severity(double spread, String serviceKey, ServiceCategory category) {
        if (spread >= settings.highSeverityVariance() || isHighRisk(serviceKey, category)) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }

    public boolean isHighRisk(String serviceKey, ServiceCategory category) {
        if (category != null && settings.highRiskCategories().contains(category)) {
            return true;
        }
        String key = serviceKey == null ? "" : serviceKey.toLowerCase(Locale.ROOT);
        return settings.highRiskKeywords().stream().anyMatch(key::contains);
    }
}
