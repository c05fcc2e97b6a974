package com.eainde.policyaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Canonical policy rule produced by the normalizer.
 *
 * <p>Sentinels instead of guesses: a tariff without a parseable amount is {@code null},
 * a tariff without a unit in its own sentence is {@link TariffUnit#UNSPECIFIED},
 * and missing facility levels or limits are empty collections.</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * Rule rule = Rule.of("Haemodialysis session")
 *         .serviceKey("dialysis:hemodialysis")
 *         .category(ServiceCategory.DIALYSIS)
 *         .limit(LimitType.PER_WEEK, 3)
 *         .sourcePage(8)
 *         .evidenceSnippet("Haemodialysis ... 3 sessions per week")
 *         .build();
 * </pre>
 *
 * @param serviceDescription     human readable service text
 * @param serviceKey             canonical grouping key, "category:tokens"
 * @param category               clinical category
 * @param tariffValue            tariff amount, null when none was found
 * @param tariffUnit             unit the tariff is billed per
 * @param coverageStatus         included or excluded
 * @param facilityLevels         sorted facility levels the rule talks about
 * @param limits                 utilization limits by window
 * @param coverageConditions     access conditions such as pre-authorization
 * @param sourcePage             1-based source page
 * @param evidenceSnippet        excerpt shown as evidence
 * @param extractionConfidence   weakest confidence among the extracted fields
 * @param collaboratorAgreement  agreement score from the reasoning collaborator, null if not reviewed
 */
public record Rule(
        @JsonProperty("service")                String serviceDescription,
        @JsonProperty("service_key")            String serviceKey,
        @JsonProperty("category")               ServiceCategory category,
        @JsonProperty("tariff_value")           BigDecimal tariffValue,
        @JsonProperty("tariff_unit")            TariffUnit tariffUnit,
        @JsonProperty("coverage_status")        CoverageStatus coverageStatus,
        @JsonProperty("facility_levels")        SortedSet<Integer> facilityLevels,
        @JsonProperty("limits")                 Map<LimitType, Integer> limits,
        @JsonProperty("coverage_conditions")    Set<CoverageCondition> coverageConditions,
        @JsonProperty("source_page")            int sourcePage,
        @JsonProperty("evidence_snippet")       String evidenceSnippet,
        @JsonProperty("extraction_confidence")  ConfidenceTier extractionConfidence,
        @JsonProperty("collaborator_agreement") Double collaboratorAgreement
) {

    public Rule {
        Objects.requireNonNull(serviceDescription, "serviceDescription");
        category = category == null ? ServiceCategory.OTHER : category;
        tariffUnit = tariffUnit == null ? TariffUnit.UNSPECIFIED : tariffUnit;
        coverageStatus = coverageStatus == null ? CoverageStatus.INCLUDED : coverageStatus;
        facilityLevels = facilityLevels == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(facilityLevels));
        limits = limits == null || limits.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(limits));
        coverageConditions = coverageConditions == null || coverageConditions.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(coverageConditions));
        extractionConfidence = extractionConfidence == null ? ConfidenceTier.LOW : extractionConfidence;
        evidenceSnippet = evidenceSnippet == null ? "" : evidenceSnippet;
    }

    public static Builder of(String serviceDescription) {
        return new Builder(serviceDescription);
    }

    public Builder toBuilder() {
        Builder b = new Builder(serviceDescription)
                .serviceKey(serviceKey)
                .category(category)
                .tariff(tariffValue, tariffUnit)
                .coverageStatus(coverageStatus)
                .facilityLevels(facilityLevels)
                .coverageConditions(coverageConditions)
                .sourcePage(sourcePage)
                .evidenceSnippet(evidenceSnippet)
                .extractionConfidence(extractionConfidence)
                .collaboratorAgreement(collaboratorAgreement);
        limits.forEach(b::limit);
        return b;
    }

    public Rule withServiceKey(String key) {
        return toBuilder().serviceKey(key).build();
    }

    public Rule withCollaboratorAgreement(Double agreement) {
        return toBuilder().collaboratorAgreement(agreement).build();
    }

    public boolean hasTariff() {
        return tariffValue != null;
    }

    public boolean isExcluded() {
        return coverageStatus == CoverageStatus.EXCLUDED;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static final class Builder {

        private final String serviceDescription;
        private String serviceKey;
        private ServiceCategory category = ServiceCategory.OTHER;
        private BigDecimal tariffValue;
        private TariffUnit tariffUnit = TariffUnit.UNSPECIFIED;
        private CoverageStatus coverageStatus = CoverageStatus.INCLUDED;
        private final SortedSet<Integer> facilityLevels = new TreeSet<>();
        private final Map<LimitType, Integer> limits = new EnumMap<>(LimitType.class);
        private final Set<CoverageCondition> coverageConditions = EnumSet.noneOf(CoverageCondition.class);
        private int sourcePage = 1;
        private String evidenceSnippet;
        private ConfidenceTier extractionConfidence = ConfidenceTier.HIGH;
        private Double collaboratorAgreement;

        private Builder(String serviceDescription) {
            this.serviceDescription = serviceDescription;
        }

        public Builder serviceKey(String serviceKey) {
            this.serviceKey = serviceKey;
            return this;
        }

        public Builder category(ServiceCategory category) {
            this.category = category;
            return this;
        }

        public Builder tariff(BigDecimal value, TariffUnit unit) {
            this.tariffValue = value;
            this.tariffUnit = unit;
            return this;
        }

        public Builder tariff(long value, TariffUnit unit) {
            return tariff(BigDecimal.valueOf(value), unit);
        }

        public Builder coverageStatus(CoverageStatus coverageStatus) {
            this.coverageStatus = coverageStatus;
            return this;
        }

        public Builder facilityLevels(Set<Integer> levels) {
            this.facilityLevels.clear();
            this.facilityLevels.addAll(levels);
            return this;
        }

        public Builder facilityLevels(Integer... levels) {
            return facilityLevels(new TreeSet<>(Arrays.asList(levels)));
        }

        public Builder limit(LimitType type, int value) {
            this.limits.put(type, value);
            return this;
        }

        public Builder coverageConditions(Set<CoverageCondition> conditions) {
            this.coverageConditions.clear();
            this.coverageConditions.addAll(conditions);
            return this;
        }

        public Builder sourcePage(int sourcePage) {
            this.sourcePage = sourcePage;
            return this;
        }

        public Builder evidenceSnippet(String evidenceSnippet) {
            this.evidenceSnippet = evidenceSnippet;
            return this;
        }

        public Builder extractionConfidence(ConfidenceTier extractionConfidence) {
            this.extractionConfidence = extractionConfidence;
            return this;
        }

        public Builder collaboratorAgreement(Double collaboratorAgreement) {
            this.collaboratorAgreement = collaboratorAgreement;
            return this;
        }

        public Rule build() {
            return new Rule(serviceDescription, serviceKey, category, tariffValue, tariffUnit,
                    coverageStatus, facilityLevels, limits, coverageConditions, sourcePage,
                    evidenceSnippet == null ? serviceDescription : evidenceSnippet,
                    extractionConfidence, collaboratorAgreement);
        }
    }
}
