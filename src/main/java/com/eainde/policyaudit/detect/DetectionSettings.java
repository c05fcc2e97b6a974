package com.eainde.policyaudit.detect;

import com.eainde.policyaudit.model.ServiceCategory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Thresholds shared by the contradiction detectors.
 *
 * @param tariffVarianceThreshold relative spread (max-min)/min a tariff group must exceed to be flagged
 * @param highSeverityVariance    spread at or above which any finding is HIGH severity
 * @param highRiskCategories      categories whose findings are always HIGH severity
 * @param highRiskKeywords        service-key fragments treated as clinically high risk
 */
public record DetectionSettings(
        double tariffVarianceThreshold,
        double highSeverityVariance,
        Set<ServiceCategory> highRiskCategories,
        List<String> highRiskKeywords
) {

    public static final double DEFAULT_TARIFF_VARIANCE_THRESHOLD = 0.20;
    public static final double DEFAULT_HIGH_SEVERITY_VARIANCE = 0.50;

    public DetectionSettings {
        if (tariffVarianceThreshold < 0.0) {
            throw new IllegalArgumentException(
                    "tariffVarianceThreshold must be >= 0 but was " + tariffVarianceThreshold);
        }
        if (highSeverityVariance <= 0.0) {
            throw new IllegalArgumentException(
                    "highSeverityVariance must be > 0 but was " + highSeverityVariance);
        }
        highRiskCategories = highRiskCategories == null || highRiskCategories.isEmpty()
                ? Set.of() : Set.copyOf(highRiskCategories);
        highRiskKeywords = highRiskKeywords == null ? List.of() : List.copyOf(highRiskKeywords);
    }

    public static DetectionSettings defaults() {
        return new DetectionSettings(
                DEFAULT_TARIFF_VARIANCE_THRESHOLD,
                DEFAULT_HIGH_SEVERITY_VARIANCE,
                EnumSet.of(ServiceCategory.DIALYSIS, ServiceCategory.ONCOLOGY,
                        ServiceCategory.MATERNITY, ServiceCategory.EMERGENCY),
                List.of("dialysis", "oncology", "cancer", "chemotherapy", "maternity", "emergency"));
    }
}
