package com.eainde.policyaudit.gap;

import com.eainde.policyaudit.key.StringSimilarity;
import com.eainde.policyaudit.model.ConfidenceTier;
import com.eainde.policyaudit.model.Gap;
import com.eainde.policyaudit.model.GapStatus;
import com.eainde.policyaudit.model.Rule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks each expected condition against the rule set and reports how well it is covered.
 *
 * <h3>Matching:</h3>
 * <p>A rule matches a condition when one of the condition's keywords appears in the rule's
 * description or evidence snippet, either as a case-insensitive substring or, for keywords of
 * {@value #FUZZY_MIN_KEYWORD_LENGTH}+ characters, as a token at least
 * {@value #FUZZY_TOKEN_THRESHOLD} similar ("physioterapy" still counts as physiotherapy).</p>
 *
 * <h3>Status:</h3>
 * <pre>
 * 0 matching rules                   → NO_COVERAGE_FOUND
 * fewer than adequacyThreshold rules → MINIMAL_COVERAGE
 * otherwise                          → ADEQUATE
 * </pre>
 *
 * <p>The mapping is validated at construction; an unusable mapping fails fast with
 * {@link InvalidExpectationConfigException}.</p>
 */
@Slf4j
public class GapAnalyzer {

    public static final int DEFAULT_ADEQUACY_THRESHOLD = 2;

    static final int FUZZY_MIN_KEYWORD_LENGTH = 5;
    static final double FUZZY_TOKEN_THRESHOLD = 0.85;

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9]+");

    private final List<ConditionExpectation> expectations;
    private final int adequacyThreshold;

    public GapAnalyzer(ExpectationConfig config, int adequacyThreshold) {
        if (adequacyThreshold < 1) {
            throw new InvalidExpectationConfigException(
                    "adequacyThreshold must be >= 1 but was " + adequacyThreshold);
        }
        if (config == null) {
            throw new InvalidExpectationConfigException("No expectation mapping supplied");
        }
        this.expectations = config.validate();
        this.adequacyThreshold = adequacyThreshold;
        log.info("Gap analyzer ready: {} expected conditions, adequacy threshold {}",
                expectations.size(), adequacyThreshold);
    }

    public GapAnalyzer(ExpectationConfig config) {
        this(config, DEFAULT_ADEQUACY_THRESHOLD);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /** One {@link Gap} per expected condition, in mapping order, including ADEQUATE ones. */
    public List<Gap> analyze(List<Rule> rules) {
        List<Gap> gaps = new ArrayList<>(expectations.size());
        for (ConditionExpectation expectation : expectations) {
            gaps.add(assess(expectation, rules));
        }
        log.info("Gap analysis: {} conditions, {} without coverage, {} minimal",
                gaps.size(),
                gaps.stream().filter(g -> g.status() == GapStatus.NO_COVERAGE_FOUND).count(),
                gaps.stream().filter(g -> g.status() == GapStatus.MINIMAL_COVERAGE).count());
        return gaps;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private Gap assess(ConditionExpectation expectation, List<Rule> rules) {
        List<Rule> matches = rules.stream()
                .filter(rule -> matches(rule, expectation.keywords()))
                .sorted(Comparator.comparingInt(Rule::sourcePage))
                .toList();

        GapStatus status;
        if (matches.isEmpty()) {
            status = GapStatus.NO_COVERAGE_FOUND;
        } else if (matches.size() < adequacyThreshold) {
            status = GapStatus.MINIMAL_COVERAGE;
        } else {
            status = GapStatus.ADEQUATE;
        }

        List<String> evidence = matches.stream()
                .map(r -> "p." + r.sourcePage() + ": " + r.evidenceSnippet())
                .toList();
        List<Integer> pages = matches.stream().map(Rule::sourcePage).toList();
        ConfidenceTier weakest = matches.isEmpty()
                ? null
                : ConfidenceTier.weakest(matches.stream().map(Rule::extractionConfidence).toArray(ConfidenceTier[]::new));

        log.debug("Condition '{}': {} matching rules -> {}", expectation.condition(), matches.size(), status);
        return new Gap(expectation.condition(), expectation.keywords(), status, expectation.riskLevel(),
                evidence, pages, rules.size(), weakest, recommendation(expectation.condition(), status), null);
    }

    static boolean matches(Rule rule, List<String> keywords) {
        String haystack = (rule.serviceDescription() + " " + rule.evidenceSnippet()).toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (haystack.contains(keyword)) {
                return true;
            }
        }
        String[] tokens = TOKEN_SPLIT.split(haystack);
        for (String keyword : keywords) {
            if (keyword.length() < FUZZY_MIN_KEYWORD_LENGTH || keyword.contains(" ")) {
                continue;
            }
            for (String token : tokens) {
                if (Math.abs(token.length() - keyword.length()) <= 2
                        && StringSimilarity.ratio(token, keyword) >= FUZZY_TOKEN_THRESHOLD) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String recommendation(String condition, GapStatus status) {
        switch (status) {
            case NO_COVERAGE_FOUND:
                return "Add " + condition + " coverage";
            case MINIMAL_COVERAGE:
                return "Expand " + condition + " coverage";
            default:
                return null;
        }
    }
}
