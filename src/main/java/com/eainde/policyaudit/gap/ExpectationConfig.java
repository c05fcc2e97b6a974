package com.eainde.policyaudit.gap;

import com.eainde.policyaudit.model.RiskLevel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Expectation mapping as read from YAML:
 *
 * <pre>
 * conditions:
 *   stroke rehabilitation:
 *     expected_keywords: [physiotherapy, rehabilitation]
 *     risk_level: HIGH
 * </pre>
 *
 * <p>{@link #validate()} turns the raw mapping into {@link ConditionExpectation}s and fails
 * with {@link InvalidExpectationConfigException} on the first unusable entry.</p>
 *
 * @param conditions condition name to raw entry, in file order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExpectationConfig(
        @JsonProperty("conditions") Map<String, Entry> conditions
) {

    /**
     * @param expectedKeywords keywords that count as coverage
     * @param riskLevel        HIGH, MEDIUM or LOW
     * @param notes            optional free text
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
            @JsonProperty("expected_keywords") List<String> expectedKeywords,
            @JsonProperty("risk_level")        String riskLevel,
            @JsonProperty("notes")             String notes
    ) {
    }

    public static ExpectationConfig of(Map<String, Entry> conditions) {
        return new ExpectationConfig(new LinkedHashMap<>(conditions));
    }

    public List<ConditionExpectation> validate() {
        if (conditions == null || conditions.isEmpty()) {
            throw new InvalidExpectationConfigException("Expectation mapping has no conditions");
        }
        List<ConditionExpectation> expectations = new ArrayList<>(conditions.size());
        for (Map.Entry<String, Entry> e : conditions.entrySet()) {
            String name = e.getKey();
            Entry entry = e.getValue();
            if (name == null || name.isBlank()) {
                throw new InvalidExpectationConfigException("Expectation mapping has a condition without a name");
            }
            if (entry == null) {
                throw new InvalidExpectationConfigException("Condition '" + name + "' has no entry");
            }
            if (entry.expectedKeywords() == null || entry.expectedKeywords().isEmpty()) {
                throw new InvalidExpectationConfigException(
                        "Condition '" + name + "' must list at least one expected keyword");
            }
            List<String> keywords = new ArrayList<>();
            for (String keyword : entry.expectedKeywords()) {
                if (keyword == null || keyword.isBlank()) {
                    throw new InvalidExpectationConfigException(
                            "Condition '" + name + "' has a blank expected keyword");
                }
                keywords.add(keyword.strip().toLowerCase(Locale.ROOT));
            }
            expectations.add(new ConditionExpectation(name.strip(), keywords, parseRisk(name, entry.riskLevel()),
                    entry.notes()));
        }
        return expectations;
    }

    private static RiskLevel parseRisk(String condition, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidExpectationConfigException("Condition '" + condition + "' has no risk_level");
        }
        try {
            return RiskLevel.valueOf(raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidExpectationConfigException(
                    "Condition '" + condition + "' has invalid risk_level '" + raw + "' (expected HIGH, MEDIUM or LOW)", e);
        }
    }
}
