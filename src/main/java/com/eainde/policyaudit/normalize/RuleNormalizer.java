package com.eainde.policyaudit.normalize;

import com.eainde.policyaudit.model.ConfidenceTier;
import com.eainde.policyaudit.model.CoverageStatus;
import com.eainde.policyaudit.model.RawRuleRecord;
import com.eainde.policyaudit.model.Rule;
import com.eainde.policyaudit.model.ServiceCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw extracted rows into canonical {@link Rule} records.
 *
 * <p>Each field has its own extractor running an ordered strategy list. Anything that
 * cannot be parsed gets its sentinel (null tariff, UNSPECIFIED unit, empty levels or limits)
 * and lowers the rule's extraction confidence; nothing is guessed.</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * RuleNormalizer normalizer = RuleNormalizer.builder()
 *         .facilityLevelRange(1, 6)
 *         .snippetLength(150, 300)
 *         .build();
 *
 * List&lt;Rule&gt; rules = normalizer.normalizeAll(records);
 * </pre>
 *
 * <p>Service keys are left unset here; the key resolver assigns them over the whole set.</p>
 */
@Slf4j
public class RuleNormalizer {

    /** First token that starts the "terms" part of a row rather than the service name. */
    private static final Pattern DESCRIPTION_END = Pattern.compile(
            "(?i)(?:\\b(?:kshs|ksh|kes)\\b|\\d|\\blevels?\\b|\\btiers?\\b|\\bper\\b|\\bnot\\b|\\bexcluded\\b"
                    + "|\\bcovered\\b|\\bup\\s+to\\b|\\bmax(?:imum)?\\b|\\bonce\\b|\\btwice\\b|\\bthrice\\b)");

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s:;,.\\-–(|]+$");

    private static final int FALLBACK_DESCRIPTION_LENGTH = 60;

    private final TariffUnitBinder tariffBinder;
    private final FacilityLevelCanonicalizer facilityCanonicalizer;
    private final CoverageStatusClassifier coverageClassifier;
    private final LimitExtractor limitExtractor;
    private final ServiceCategorizer categorizer;
    private final CoverageConditionExtractor conditionExtractor;
    private final EvidenceSnippets snippets;

    private RuleNormalizer(Builder builder) {
        this.facilityCanonicalizer = new FacilityLevelCanonicalizer(builder.minLevel, builder.maxLevel);
        this.coverageClassifier = new CoverageStatusClassifier(facilityCanonicalizer);
        this.tariffBinder = new TariffUnitBinder();
        this.limitExtractor = new LimitExtractor();
        this.categorizer = new ServiceCategorizer();
        this.conditionExtractor = new CoverageConditionExtractor();
        this.snippets = new EvidenceSnippets(builder.minSnippetLength, builder.maxSnippetLength);
    }

    public static Builder builder() {
        return new Builder();
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public List<Rule> normalizeAll(List<RawRuleRecord> records) {
        List<Rule> rules = new ArrayList<>(records.size());
        for (RawRuleRecord record : records) {
            rules.add(normalize(record));
        }
        long low = rules.stream().filter(r -> r.extractionConfidence() == ConfidenceTier.LOW).count();
        log.info("Normalized {} rows into rules ({} with LOW extraction confidence)", rules.size(), low);
        return rules;
    }

    public Rule normalize(RawRuleRecord record) {
        String text = record.rawText();
        List<ConfidenceTier> found = new ArrayList<>();
        int anchor = -1;

        // ── Tariff + unit ──────────────────────────────────────────────
        TariffUnitBinder.TariffExtraction tariff =
                tariffBinder.bind(text, record.candidateAmounts(), record.candidateUnits());
        if (!tariff.isEmpty()) {
            found.add(tariff.confidence());
            anchor = tariff.anchor();
        }

        // ── Coverage status ────────────────────────────────────────────
        PatternMatch<CoverageStatus> coverage = coverageClassifier.classify(text);
        if (!"default".equals(coverage.strategy())) {
            found.add(coverage.confidence());
            if (anchor < 0) anchor = coverage.anchor();
        }

        // ── Facility levels ────────────────────────────────────────────
        Optional<PatternMatch<SortedSet<Integer>>> levels =
                facilityCanonicalizer.canonicalize(text, record.candidateFacilityMentions());
        SortedSet<Integer> facilityLevels = levels.map(PatternMatch::value).orElse(null);
        if (levels.isPresent()) {
            found.add(levels.get().confidence());
        }
        if (coverage.value() == CoverageStatus.EXCLUDED) {
            SortedSet<Integer> excluded = coverageClassifier.excludedLevels(text);
            if (!excluded.isEmpty()) {
                facilityLevels = excluded;
            }
        }

        // ── Limits ─────────────────────────────────────────────────────
        LimitExtractor.LimitExtraction limits = limitExtractor.extract(text, record.candidateLimitPhrases());
        if (!limits.isEmpty()) {
            found.add(limits.confidence());
            if (anchor < 0) anchor = limits.anchor();
        }

        // ── Description, category, conditions ──────────────────────────
        String description = describe(record);
        ServiceCategory category = categorizer.categorize(description, text, record.categoryHint());
        ConfidenceTier confidence = found.isEmpty()
                ? ConfidenceTier.LOW
                : ConfidenceTier.weakest(found.toArray(new ConfidenceTier[0]));

        Rule.Builder rule = Rule.of(description)
                .category(category)
                .coverageStatus(coverage.value())
                .coverageConditions(conditionExtractor.extract(text))
                .sourcePage(record.pageIndex())
                .evidenceSnippet(snippets.snippet(text, anchor))
                .extractionConfidence(confidence);
        tariff.tariff().ifPresent(t -> rule.tariff(t.value(), t.unit()));
        if (facilityLevels != null) {
            rule.facilityLevels(facilityLevels);
        }
        limits.limits().forEach(rule::limit);

        Rule built = rule.build();
        if (log.isDebugEnabled()) {
            log.debug("p.{} '{}' -> {} {} {} levels={} limits={} [{}]", built.sourcePage(), description,
                    built.tariffValue(), built.tariffUnit().label(), built.coverageStatus(),
                    built.facilityLevels(), built.limits(), confidence);
        }
        return built;
    }

    /**
     * Service description: the extractor's service cell when present, else the first table
     * cell, else the row text up to the first amount, level, or limit phrase.
     */
    String describe(RawRuleRecord record) {
        if (record.serviceText() != null && !record.serviceText().isBlank()) {
            return TextSpans.collapseWhitespace(record.serviceText());
        }
        String text = TextSpans.collapseWhitespace(record.rawText());
        if (text.contains("|")) {
            String firstCell = TRAILING_PUNCTUATION.matcher(text.substring(0, text.indexOf('|'))).replaceAll("");
            if (firstCell.length() >= 3) {
                return firstCell.strip();
            }
        }
        Matcher m = DESCRIPTION_END.matcher(text);
        String head = m.find() ? text.substring(0, m.start()) : text;
        head = TRAILING_PUNCTUATION.matcher(head).replaceAll("").strip();
        if (head.length() >= 3) {
            return head;
        }
        return text.length() <= FALLBACK_DESCRIPTION_LENGTH ? text : text.substring(0, FALLBACK_DESCRIPTION_LENGTH);
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static class Builder {

        private int minLevel = 1;
        private int maxLevel = 6;
        private int minSnippetLength = EvidenceSnippets.DEFAULT_MIN_LENGTH;
        private int maxSnippetLength = EvidenceSnippets.DEFAULT_MAX_LENGTH;

        private Builder() {
        }

        public Builder facilityLevelRange(int minLevel, int maxLevel) {
            this.minLevel = minLevel;
            this.maxLevel = maxLevel;
            return this;
        }

        public Builder snippetLength(int minLength, int maxLength) {
            this.minSnippetLength = minLength;
            this.maxSnippetLength = maxLength;
            return this;
        }

        public RuleNormalizer build() {
            return new RuleNormalizer(this);
        }
    }
}
