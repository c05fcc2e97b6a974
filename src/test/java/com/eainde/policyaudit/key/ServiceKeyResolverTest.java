package com.eainde.policyaudit.key;

import com.eainde.policyaudit.model.Rule;
import com.eainde.policyaudit.model.ServiceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceKeyResolverTest {

    private final ServiceKeyResolver resolver = new ServiceKeyResolver();

    private static Rule rule(String description, ServiceCategory category, int page) {
        return Rule.of(description).category(category).sourcePage(page).build();
    }

    @Nested
    @DisplayName("resolve()")
    class Resolve {

        @Test
        @DisplayName("abbreviations and spelling variants share one key")
        void variants() {
            assertThat(resolver.resolve("Haemodialysis session", ServiceCategory.DIALYSIS))
                    .isEqualTo("dialysis:hemodialysis");
            assertThat(resolver.resolve("HD (per session)", ServiceCategory.DIALYSIS))
                    .isEqualTo("dialysis:hemodialysis");
        }

        @Test
        @DisplayName("stop words and numbers are dropped")
        void stopWords() {
            assertThat(resolver.resolve("Caesarean section delivery at Level 4", ServiceCategory.MATERNITY))
                    .isEqualTo("maternity:caesarean_section_delivery");
        }

        @Test
        @DisplayName("empty description becomes 'general'")
        void empty() {
            assertThat(resolver.resolve("  ", null)).isEqualTo("other:general");
            assertThat(ServiceKeyResolver.isUnresolved("other:general")).isTrue();
            assertThat(ServiceKeyResolver.isUnresolved("dialysis:hemodialysis")).isFalse();
        }
    }

    @Nested
    @DisplayName("resolveAll()")
    class ResolveAll {

        @Test
        @DisplayName("near spellings above the threshold merge onto one key")
        void fuzzyMerge() {
            List<Rule> resolved = resolver.resolveAll(List.of(
                    rule("Hemodialysis", ServiceCategory.DIALYSIS, 8),
                    rule("Hemodialisis", ServiceCategory.DIALYSIS, 15)));

            assertThat(resolved.get(0).serviceKey()).isEqualTo(resolved.get(1).serviceKey());
        }

        @Test
        @DisplayName("different categories never merge")
        void categoriesStayApart() {
            List<Rule> resolved = resolver.resolveAll(List.of(
                    rule("Physiotherapy", ServiceCategory.REHABILITATION, 2),
                    rule("Physiotherapy", ServiceCategory.OUTPATIENT, 3)));

            assertThat(resolved).extracting(Rule::serviceKey)
                    .containsExactly("rehabilitation:physiotherapy", "outpatient:physiotherapy");
        }

        @Test
        @DisplayName("unrelated services keep distinct keys")
        void distinct() {
            List<Rule> resolved = resolver.resolveAll(List.of(
                    rule("MRI scan", ServiceCategory.IMAGING, 2),
                    rule("Ultrasound", ServiceCategory.IMAGING, 3)));

            assertThat(resolved).extracting(Rule::serviceKey).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("existing keys are kept")
        void existingKey() {
            Rule keyed = Rule.of("Anything").serviceKey("custom:key").build();

            assertThat(resolver.resolveAll(List.of(keyed)).get(0).serviceKey()).isEqualTo("custom:key");
        }

        @Test
        @DisplayName("outcome does not depend on row order")
        void orderIndependent() {
            List<Rule> rules = new ArrayList<>(List.of(
                    rule("Hemodialysis", ServiceCategory.DIALYSIS, 1),
                    rule("Hemodialisis", ServiceCategory.DIALYSIS, 2),
                    rule("Haemodialysis session", ServiceCategory.DIALYSIS, 3)));
            List<String> forward = resolver.resolveAll(rules).stream().map(Rule::serviceKey).sorted().toList();
            Collections.reverse(rules);
            List<String> backward = resolver.resolveAll(rules).stream().map(Rule::serviceKey).sorted().toList();

            assertThat(backward).isEqualTo(forward);
        }
    }

    @Test
    @DisplayName("threshold must lie in (0, 1]")
    void thresholdValidation() {
        assertThatThrownBy(() -> new ServiceKeyResolver(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ServiceKeyResolver(1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
