package com.eainde.policyaudit.detect;

import com.eainde.policyaudit.model.ConfidenceTier;
import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.ContradictionType;
import com.eainde.policyaudit.model.CoverageStatus;
import com.eainde.policyaudit.model.LimitType;
import com.eainde.policyaudit.model.Rule;
import com.eainde.policyaudit.model.ServiceCategory;
import com.eainde.policyaudit.model.Severity;
import com.eainde.policyaudit.model.TariffUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ContradictionDetectorTest {

    private final ContradictionDetector detector = new ContradictionDetector(DetectionSettings.defaults());

    private static Rule.Builder dialysis(int page) {
        return Rule.of("Haemodialysis")
                .serviceKey("dialysis:hemodialysis")
                .category(ServiceCategory.DIALYSIS)
                .sourcePage(page)
                .evidenceSnippet("Haemodialysis evidence on page " + page);
    }

    private static Rule.Builder imaging(int page) {
        return Rule.of("MRI scan")
                .serviceKey("imaging:mri_scan")
                .category(ServiceCategory.IMAGING)
                .sourcePage(page)
                .evidenceSnippet("MRI scan evidence on page " + page);
    }

    @Nested
    @DisplayName("limits")
    class Limits {

        @Test
        @DisplayName("3 vs 2 sessions per week is one HIGH finding, earlier page left")
        void hemodialysisPerWeek() {
            List<Contradiction> findings = detector.detectAll(List.of(
                    dialysis(15).limit(LimitType.PER_WEEK, 2).build(),
                    dialysis(8).limit(LimitType.PER_WEEK, 3).build()));

            assertThat(findings).hasSize(1);
            Contradiction c = findings.get(0);
            assertThat(c.type()).isEqualTo(ContradictionType.LIMIT);
            assertThat(c.serviceKey()).isEqualTo("dialysis:hemodialysis");
            assertThat(c.unit()).isEqualTo("per_week");
            assertThat(c.details()).isEqualTo("3 vs 2 per_week");
            assertThat(c.severity()).isEqualTo(Severity.HIGH);
            assertThat(c.left().page()).isEqualTo(8);
            assertThat(c.right().page()).isEqualTo(15);
            assertThat(c.supportingRuleCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("different windows are not compared")
        void differentWindows() {
            assertThat(detector.detectAll(List.of(
                    dialysis(8).limit(LimitType.PER_WEEK, 3).build(),
                    dialysis(15).limit(LimitType.PER_MONTH, 12).build()))).isEmpty();
        }
    }

    @Nested
    @DisplayName("tariffs")
    class Tariffs {

        @Test
        @DisplayName("per_session vs per_day is never a tariff contradiction")
        void differentUnits() {
            assertThat(detector.detectAll(List.of(
                    dialysis(8).tariff(10_650, TariffUnit.PER_SESSION).build(),
                    dialysis(15).tariff(3_000, TariffUnit.PER_DAY).build()))).isEmpty();
        }

        @Test
        @DisplayName("unspecified units are never compared")
        void unspecified() {
            assertThat(detector.detectAll(List.of(
                    dialysis(8).tariff(10_650, TariffUnit.UNSPECIFIED).build(),
                    dialysis(15).tariff(2_000, TariffUnit.UNSPECIFIED).build()))).isEmpty();
        }

        @Test
        @DisplayName("a violating group yields exactly one finding")
        void oneFindingPerGroup() {
            List<Contradiction> findings = detector.detectAll(List.of(
                    imaging(3).tariff(8_000, TariffUnit.PER_SESSION).build(),
                    imaging(5).tariff(9_000, TariffUnit.PER_SESSION).build(),
                    imaging(7).tariff(12_000, TariffUnit.PER_SESSION).build()));

            assertThat(findings).hasSize(1);
            Contradiction c = findings.get(0);
            assertThat(c.type()).isEqualTo(ContradictionType.TARIFF);
            assertThat(c.unit()).isEqualTo("per_session");
            assertThat(c.details()).isEqualTo("KES 8000 vs KES 12000 per_session (variance 50%)");
            assertThat(c.left().page()).isEqualTo(3);
            assertThat(c.right().page()).isEqualTo(7);
            assertThat(c.severity()).isEqualTo(Severity.HIGH);
            assertThat(c.supportingRuleCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("spread within the threshold is tolerated")
        void withinThreshold() {
            assertThat(detector.detectAll(List.of(
                    imaging(3).tariff(10_000, TariffUnit.PER_SESSION).build(),
                    imaging(5).tariff(11_000, TariffUnit.PER_SESSION).build()))).isEmpty();
        }

        @Test
        @DisplayName("moderate spread on a low-risk service is MEDIUM")
        void mediumSeverity() {
            List<Contradiction> findings = detector.detectAll(List.of(
                    imaging(3).tariff(10_000, TariffUnit.PER_SESSION).build(),
                    imaging(5).tariff(13_000, TariffUnit.PER_SESSION).build()));

            assertThat(findings).singleElement()
                    .extracting(Contradiction::severity).isEqualTo(Severity.MEDIUM);
        }
    }

    @Nested
    @DisplayName("coverage")
    class Coverage {

        @Test
        @DisplayName("included on one page and excluded on another")
        void includedVsExcluded() {
            List<Contradiction> findings = detector.detectAll(List.of(
                    imaging(9).coverageStatus(CoverageStatus.EXCLUDED).build(),
                    imaging(2).coverageStatus(CoverageStatus.INCLUDED).build()));

            assertThat(findings).singleElement().satisfies(c -> {
                assertThat(c.type()).isEqualTo(ContradictionType.COVERAGE);
                assertThat(c.details()).isEqualTo("Included (p.2) vs Excluded (p.9)");
                assertThat(c.severity()).isEqualTo(Severity.HIGH);
            });
        }
    }

    @Nested
    @DisplayName("facility exclusion")
    class FacilityExclusion {

        @Test
        @DisplayName("one finding per overlapping level")
        void overlap() {
            List<Contradiction> findings = detector.detectAll(List.of(
                    imaging(4).coverageStatus(CoverageStatus.EXCLUDED).facilityLevels(2, 3).build(),
                    imaging(6).facilityLevels(3, 4, 5).build()));

            assertThat(findings)
                    .filteredOn(c -> c.type() == ContradictionType.FACILITY_EXCLUSION)
                    .singleElement()
                    .satisfies(c -> {
                        assertThat(c.unit()).isEqualTo("level_3");
                        assertThat(c.details()).isEqualTo("Level 3 excluded (p.4) but included (p.6)");
                        assertThat(c.left().page()).isEqualTo(4);
                    });
        }

        @Test
        @DisplayName("disjoint level sets produce nothing")
        void disjoint() {
            List<Contradiction> findings = detector.detectAll(List.of(
                    imaging(4).coverageStatus(CoverageStatus.EXCLUDED).facilityLevels(2, 3).build(),
                    imaging(6).facilityLevels(4, 5, 6).build()));

            assertThat(findings).noneMatch(c -> c.type() == ContradictionType.FACILITY_EXCLUSION);
        }
    }

    @Test
    @DisplayName("confidence averages the extraction confidence of both sides")
    void confidence() {
        List<Contradiction> findings = detector.detectAll(List.of(
                dialysis(8).limit(LimitType.PER_WEEK, 3).extractionConfidence(ConfidenceTier.HIGH).build(),
                dialysis(15).limit(LimitType.PER_WEEK, 2).extractionConfidence(ConfidenceTier.LOW).build()));

        assertThat(findings.get(0).confidence()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    @DisplayName("rules whose key names no service are not grouped together")
    void unresolvedKey() {
        Rule.Builder first = Rule.of("KES 3,000 per session").serviceKey("other:general")
                .sourcePage(4).evidenceSnippet("KES 3,000 per session");
        Rule.Builder second = Rule.of("KES 45,000 per session").serviceKey("other:general")
                .sourcePage(19).evidenceSnippet("KES 45,000 per session");

        assertThat(detector.detectAll(List.of(
                first.tariff(3_000, TariffUnit.PER_SESSION).coverageStatus(CoverageStatus.INCLUDED).build(),
                second.tariff(45_000, TariffUnit.PER_SESSION).coverageStatus(CoverageStatus.EXCLUDED).build())))
                .isEmpty();
    }

    @Test
    @DisplayName("rules without a service key are ignored")
    void noKey() {
        assertThat(detector.detectAll(List.of(
                Rule.of("x").limit(LimitType.PER_WEEK, 3).sourcePage(1).build(),
                Rule.of("x").limit(LimitType.PER_WEEK, 2).sourcePage(2).build()))).isEmpty();
    }
}
