package com.eainde.policyaudit.gap;

import com.eainde.policyaudit.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpectationConfigLoaderTest {

    private final ExpectationConfigLoader loader = new ExpectationConfigLoader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("bundled mapping loads and validates")
    void bundledMapping() {
        List<ConditionExpectation> expectations = loader.load("classpath:expectations.yaml").validate();

        assertThat(expectations).hasSize(12);
        assertThat(expectations)
                .filteredOn(e -> e.condition().equals("Stroke rehabilitation"))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.riskLevel()).isEqualTo(RiskLevel.HIGH);
                    assertThat(e.keywords()).contains("physiotherapy");
                });
    }

    @Test
    @DisplayName("mapping from a file path, keywords lower-cased")
    void fromFile() throws IOException {
        Path file = tempDir.resolve("expectations.yaml");
        Files.writeString(file, """
                conditions:
                  Epilepsy:
                    expected_keywords: [Epilepsy, Seizure]
                    risk_level: low
                """);

        List<ConditionExpectation> expectations = loader.load(file.toString()).validate();

        assertThat(expectations).singleElement().satisfies(e -> {
            assertThat(e.keywords()).containsExactly("epilepsy", "seizure");
            assertThat(e.riskLevel()).isEqualTo(RiskLevel.LOW);
        });
    }

    @Test
    @DisplayName("a condition without risk level fails validation")
    void missingRisk() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, """
                conditions:
                  Autism:
                    expected_keywords: [autism]
                """);

        ExpectationConfig config = loader.load(file);

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidExpectationConfigException.class)
                .hasMessageContaining("Autism")
                .hasMessageContaining("risk_level");
    }

    @Test
    @DisplayName("missing files fail fast")
    void missingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.yaml").toString()))
                .isInstanceOf(InvalidExpectationConfigException.class);
        assertThatThrownBy(() -> loader.load("classpath:absent.yaml"))
                .isInstanceOf(InvalidExpectationConfigException.class);
    }
}
