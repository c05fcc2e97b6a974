package com.eainde.policyaudit.normalize;

import com.eainde.policyaudit.model.ConfidenceTier;
import com.eainde.policyaudit.model.TariffUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TariffUnitBinderTest {

    private final TariffUnitBinder binder = new TariffUnitBinder();

    private TariffUnitBinder.TariffExtraction bind(String text) {
        TariffUnitBinder.TariffExtraction match = binder.bind(text, List.of());
        assertThat(match.tariff()).as("binding for '%s'", text).isPresent();
        return match;
    }

    @Nested
    @DisplayName("explicit units")
    class Explicit {

        @Test
        @DisplayName("unit right after the amount binds with HIGH confidence")
        void unitNextToAmount() {
            TariffUnitBinder.TariffExtraction match = bind("Haemodialysis KES 10,650 per session");

            assertThat(match.binding().value()).isEqualByComparingTo(new BigDecimal("10650"));
            assertThat(match.binding().unit()).isEqualTo(TariffUnit.PER_SESSION);
            assertThat(match.confidence()).isEqualTo(ConfidenceTier.HIGH);
            assertThat(match.strategy()).isEqualTo("explicit");
        }

        @Test
        @DisplayName("shilling suffix '/-' is read as an amount")
        void shillingSuffix() {
            TariffUnitBinder.TariffExtraction match = bind("Specialist consultation 1,000/- per visit");

            assertThat(match.binding().value()).isEqualByComparingTo("1000");
            assertThat(match.binding().unit()).isEqualTo(TariffUnit.PER_VISIT);
        }
    }

    @Nested
    @DisplayName("inferred and absent units")
    class InferredAndAbsent {

        @Test
        @DisplayName("unit far away in the same sentence binds with MEDIUM confidence")
        void sameSentenceFarAway() {
            TariffUnitBinder.TariffExtraction match =
                    bind("Inpatient ward care is reimbursed per day, subject to the approved facility rate of KES 3,000");

            assertThat(match.binding().unit()).isEqualTo(TariffUnit.PER_DAY);
            assertThat(match.confidence()).isEqualTo(ConfidenceTier.MEDIUM);
        }

        @Test
        @DisplayName("unit in the next sentence is never bound")
        void neverAcrossSentences() {
            TariffUnitBinder.TariffExtraction match =
                    bind("Physiotherapy KES 1,500. Charged per session at Level 4.");

            assertThat(match.binding().value()).isEqualByComparingTo("1500");
            assertThat(match.binding().unit()).isEqualTo(TariffUnit.UNSPECIFIED);
            assertThat(match.confidence()).isEqualTo(ConfidenceTier.LOW);
        }

        @Test
        @DisplayName("a utilization limit is not mistaken for a billing unit")
        void limitIsNotUnit() {
            TariffUnitBinder.TariffExtraction match =
                    bind("Physiotherapy KES 2,000 covered up to 3 sessions per month");

            assertThat(match.binding().unit()).isEqualTo(TariffUnit.UNSPECIFIED);
        }
    }

    @Nested
    @DisplayName("amounts without a currency word")
    class BareAmounts {

        @Test
        @DisplayName("candidate amount is located in the row and bound to the unit beside it")
        void candidateLocatedInRow() {
            TariffUnitBinder.TariffExtraction match = binder.bind(
                    "Haemodialysis 10,650 per session", List.of("10,650"), List.of("per session"));

            assertThat(match.binding().value()).isEqualByComparingTo("10650");
            assertThat(match.binding().unit()).isEqualTo(TariffUnit.PER_SESSION);
            assertThat(match.confidence()).isEqualTo(ConfidenceTier.HIGH);
            assertThat(match.anchor()).isEqualTo("Haemodialysis ".length());
        }

        @Test
        @DisplayName("number written without separators still matches a formatted candidate")
        void candidateFormattingDiffers() {
            TariffUnitBinder.TariffExtraction match = binder.bind(
                    "Chemotherapy 20000 per cycle, Level 4-6", List.of("20,000"), List.of());

            assertThat(match.binding().value()).isEqualByComparingTo("20000");
            assertThat(match.binding().unit()).isEqualTo(TariffUnit.PER_SESSION);
        }

        @Test
        @DisplayName("bare number directly followed by a unit phrase is an amount")
        void unitAdjacent() {
            TariffUnitBinder.TariffExtraction match = bind("Physiotherapy 1,500 per session at Level 4");

            assertThat(match.binding().value()).isEqualByComparingTo("1500");
            assertThat(match.binding().unit()).isEqualTo(TariffUnit.PER_SESSION);
        }

        @Test
        @DisplayName("level numbers and limit counts are never read as amounts")
        void levelsAndCountsIgnored() {
            assertThat(binder.bind("Dialysis at Level 4 per session", List.of()).isEmpty()).isTrue();
            assertThat(binder.bind("Physiotherapy up to 3 sessions per month", List.of()).isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("candidate units")
    class CandidateUnits {

        @Test
        @DisplayName("extractor's unit fills in when the sentence states none")
        void reportedUnitFillsIn() {
            TariffUnitBinder.TariffExtraction match =
                    binder.bind("Inpatient ward care KES 3,000", List.of(), List.of("per day"));

            assertThat(match.binding().unit()).isEqualTo(TariffUnit.PER_DAY);
            assertThat(match.confidence()).isEqualTo(ConfidenceTier.MEDIUM);
            assertThat(match.strategy()).isEqualTo("candidate-unit");
        }

        @Test
        @DisplayName("a unit in the row's own sentence wins over the extractor's")
        void sentenceUnitWins() {
            TariffUnitBinder.TariffExtraction match =
                    binder.bind("Specialist review KES 2,000 per visit", List.of(), List.of("per day"));

            assertThat(match.binding().unit()).isEqualTo(TariffUnit.PER_VISIT);
        }

        @Test
        @DisplayName("conflicting reported units are not used")
        void conflictingReportedUnits() {
            assertThat(TariffUnitBinder.reportedUnit(List.of("per day", "per visit"))).isEmpty();
            assertThat(TariffUnitBinder.reportedUnit(List.of("session"))).contains(TariffUnit.PER_SESSION);
        }
    }

    @Nested
    @DisplayName("rows with several amounts")
    class SeveralAmounts {

        @Test
        @DisplayName("repeats of the same amount and unit agree")
        void repeatsAgree() {
            TariffUnitBinder.TariffExtraction match =
                    bind("Haemodialysis KES 10,650 per session. Claims above KES 10,650 are declined.");

            assertThat(match.binding().value()).isEqualByComparingTo("10650");
            assertThat(match.binding().unit()).isEqualTo(TariffUnit.PER_SESSION);
            assertThat(match.rejected()).isEmpty();
        }

        @Test
        @DisplayName("different values in one row reject the tariff")
        void differentValuesRejected() {
            TariffUnitBinder.TariffExtraction match = binder.bind(
                    "Haemodialysis KES 10,650 per session, KES 9,500 per session at Level 4", List.of());

            assertThat(match.tariff()).isEmpty();
            assertThat(match.isEmpty()).isFalse();
            assertThat(match.confidence()).isEqualTo(ConfidenceTier.LOW);
            assertThat(match.strategy()).isEqualTo("ambiguous");
            assertThat(match.rejected()).extracting(TariffUnitBinder.TariffBinding::value)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("9500"), new BigDecimal("10650"));
        }

        @Test
        @DisplayName("one value billed under two units rejects the tariff")
        void differentUnitsRejected() {
            TariffUnitBinder.TariffExtraction match = binder.bind(
                    "Ward care KES 3,000 per day; KES 3,000 per visit for day cases", List.of());

            assertThat(match.tariff()).isEmpty();
            assertThat(match.rejected()).extracting(TariffUnitBinder.TariffBinding::unit)
                    .containsExactlyInAnyOrder(TariffUnit.PER_DAY, TariffUnit.PER_VISIT);
        }
    }

    @Nested
    @DisplayName("candidate amounts")
    class Candidates {

        @Test
        @DisplayName("falls back to the extractor's candidate amount when the text has none")
        void candidateFallback() {
            TariffUnitBinder.TariffExtraction match = binder.bind("Dialysis consumables", List.of("10,650"));

            assertThat(match.tariff()).isPresent();
            assertThat(match.binding().value()).isEqualByComparingTo("10650");
            assertThat(match.binding().unit()).isEqualTo(TariffUnit.UNSPECIFIED);
            assertThat(match.anchor()).isEqualTo(-1);
            assertThat(match.strategy()).startsWith("candidate-");
        }

        @Test
        @DisplayName("no amount anywhere gives no tariff")
        void noAmount() {
            assertThat(binder.bind("Stroke rehabilitation services", List.of()).isEmpty()).isTrue();
        }
    }
}
