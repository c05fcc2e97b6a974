package com.eainde.policyaudit.normalize;

import com.eainde.policyaudit.model.ConfidenceTier;
import com.eainde.policyaudit.model.TariffUnit;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates monetary amounts and binds each one to the nearest unit phrase in its own sentence.
 *
 * <h3>Locating amounts (first locator that finds any wins):</h3>
 * <ol>
 *   <li><b>currency</b>: a KES/Ksh prefix or suffix, or the "/-" shilling suffix</li>
 *   <li><b>positional</b>: bare numbers in the row whose value the extractor reported as a candidate amount</li>
 *   <li><b>adjacent</b>: bare numbers immediately followed by a unit phrase ("10,650 per session")</li>
 *   <li><b>candidate</b>: the candidate amount strings themselves, without row context</li>
 * </ol>
 *
 * <h3>Binding each amount (first success wins):</h3>
 * <ol>
 *   <li><b>explicit</b>: a unit phrase within {@value #EXPLICIT_WINDOW} characters of the amount, HIGH</li>
 *   <li><b>inferred</b>: the nearest unit phrase elsewhere in the same sentence, MEDIUM</li>
 *   <li><b>candidate-unit</b>: the single unit the extractor reported for the row, MEDIUM</li>
 *   <li><b>absent</b>: the unit stays UNSPECIFIED, LOW</li>
 * </ol>
 *
 * <p>Amounts are never bound across sentences. Every amount in the row is bound; when they
 * disagree in value or unit the tariff is rejected as ambiguous rather than picking one.</p>
 */
@Slf4j
public class TariffUnitBinder {

    static final int EXPLICIT_WINDOW = 40;

    private static final String NUMBER = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)";

    /** Currency prefix, currency suffix, or the "/-" shilling suffix. */
    private static final Pattern MONEY = Pattern.compile(
            "(?i)(?:\\b(?:kshs|ksh|kes)\\.?\\s*" + NUMBER + ")"
                    + "|(?:" + NUMBER + "\\s*(?:kshs|ksh|kes)\\b)"
                    + "|(?:" + NUMBER + "\\s*/-)");

    private static final Pattern BARE_NUMBER = Pattern.compile("(?<![\\d.,])" + NUMBER);

    /** Numbers that belong to a facility level, never a tariff. */
    private static final Pattern LEVEL_LEAD = Pattern.compile("(?i)(?:\\b(?:levels?|lvl|tiers?)\\s*(?:\\d+\\s*[-–]\\s*)?)$");

    private static final String UNIT_LEAD = "(?:\\b(?:per|each|a|an|every)\\s+|/\\s*)";

    private static final Map<TariffUnit, Pattern> UNIT_PATTERNS = new EnumMap<>(Map.of(
            TariffUnit.PER_SESSION, Pattern.compile(
                    "(?i)" + UNIT_LEAD + "(?:session|treatment|sitting|cycle)s?\\b"),
            TariffUnit.PER_DAY, Pattern.compile(
                    "(?i)(?:" + UNIT_LEAD + "(?:day|night|bed[-\\s]?day)\\b|\\bper\\s+diem\\b|\\bdaily\\b)"),
            TariffUnit.PER_VISIT, Pattern.compile(
                    "(?i)" + UNIT_LEAD + "(?:visit|consultation|encounter|attendance)s?\\b"),
            TariffUnit.PER_MONTH, Pattern.compile(
                    "(?i)(?:" + UNIT_LEAD + "month\\b|\\bmonthly\\b)"),
            TariffUnit.PER_YEAR, Pattern.compile(
                    "(?i)(?:" + UNIT_LEAD + "(?:year|annum)\\b|\\bannual(?:ly)?\\b|\\byearly\\b)")));

    /** "3 sessions per month" is a utilization limit, not a billing unit. */
    private static final Pattern LIMIT_LEAD = Pattern.compile(
            "(?i)(?:\\d+\\s*(?:x|sessions?|times?|visits?|days?|treatments?|cycles?)|once|twice|thrice)\\s*$");

    record Amount(BigDecimal value, int start, int end) {
    }

    record UnitPhrase(TariffUnit unit, int start, int end) {
    }

    /** Tariff amount plus its bound unit. */
    public record TariffBinding(BigDecimal value, TariffUnit unit) {
    }

    /**
     * Binding outcome for one row.
     *
     * @param binding    the row's tariff, null when none was found or the amounts disagreed
     * @param confidence weakest confidence of the agreeing bindings, LOW when rejected
     * @param anchor     offset of the first amount in the row text, -1 when not taken from it
     * @param strategy   binding strategy of the first amount, "ambiguous" when rejected
     * @param rejected   the conflicting bindings when the row was rejected, else empty
     */
    public record TariffExtraction(TariffBinding binding, ConfidenceTier confidence, int anchor,
                                   String strategy, List<TariffBinding> rejected) {

        static TariffExtraction none() {
            return new TariffExtraction(null, ConfidenceTier.LOW, -1, "none", List.of());
        }

        public Optional<TariffBinding> tariff() {
            return Optional.ofNullable(binding);
        }

        public boolean isEmpty() {
            return binding == null && rejected.isEmpty();
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public TariffExtraction bind(String rawText, List<String> candidateAmounts) {
        return bind(rawText, candidateAmounts, List.of());
    }

    /**
     * Binds every amount of the row. The candidate lists only help to locate amounts and
     * to fill in a unit the row's own sentence does not state.
     */
    public TariffExtraction bind(String rawText, List<String> candidateAmounts, List<String> candidateUnits) {
        Optional<TariffUnit> reportedUnit = reportedUnit(candidateUnits);
        List<PatternMatch<TariffBinding>> bindings = new ArrayList<>();

        // ── Amounts located in the row text ────────────────────────────
        if (rawText != null && !rawText.isBlank()) {
            for (Amount amount : locate(rawText, candidateAmounts)) {
                bindings.add(bindAmount(rawText, amount, reportedUnit));
            }
        }

        // ── Candidate strings on their own ─────────────────────────────
        if (bindings.isEmpty()) {
            for (String candidate : candidateAmounts) {
                if (candidate == null || candidate.isBlank()) {
                    continue;
                }
                List<Amount> amounts = findAmounts(candidate, MONEY);
                if (amounts.isEmpty()) {
                    amounts = findAmounts(candidate, BARE_NUMBER);
                }
                for (Amount amount : amounts) {
                    // candidate strings carry no sentence context, so the match offset is meaningless
                    PatternMatch<TariffBinding> m = bindAmount(candidate, amount, reportedUnit);
                    bindings.add(PatternMatch.of(m.value(), m.confidence(), -1, "candidate-" + m.strategy()));
                }
            }
            if (!bindings.isEmpty()) {
                log.debug("Tariff taken from candidate amounts {}", candidateAmounts);
            }
        }
        return resolve(bindings);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private List<Amount> locate(String text, List<String> candidateAmounts) {
        List<Amount> amounts = findAmounts(text, MONEY);
        if (!amounts.isEmpty()) {
            return amounts;
        }
        amounts = candidatePositions(text, candidateAmounts);
        if (!amounts.isEmpty()) {
            return amounts;
        }
        return unitAdjacent(text);
    }

    /** Bare numbers in the row whose value matches one of the extractor's candidate amounts. */
    private static List<Amount> candidatePositions(String text, List<String> candidateAmounts) {
        Set<BigDecimal> candidates = new TreeSet<>();
        for (String candidate : candidateAmounts) {
            if (candidate != null) {
                findAmounts(candidate, BARE_NUMBER).forEach(a -> candidates.add(a.value()));
            }
        }
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<Amount> amounts = new ArrayList<>();
        for (Amount amount : findAmounts(text, BARE_NUMBER)) {
            if (candidates.contains(amount.value()) && !isLevelNumber(text, amount)) {
                amounts.add(amount);
            }
        }
        return amounts;
    }

    /** Bare numbers with a billing unit phrase right after them. */
    private static List<Amount> unitAdjacent(String text) {
        List<Amount> amounts = new ArrayList<>();
        for (Amount amount : findAmounts(text, BARE_NUMBER)) {
            if (isLevelNumber(text, amount)) {
                continue;
            }
            String rest = text.substring(amount.end());
            for (Pattern pattern : UNIT_PATTERNS.values()) {
                Matcher m = pattern.matcher(rest);
                if (m.find() && rest.substring(0, m.start()).isBlank()) {
                    amounts.add(amount);
                    break;
                }
            }
        }
        return amounts;
    }

    private static boolean isLevelNumber(String text, Amount amount) {
        return LEVEL_LEAD.matcher(text.substring(Math.max(0, amount.start() - 20), amount.start())).find();
    }

    private PatternMatch<TariffBinding> bindAmount(String text, Amount amount, Optional<TariffUnit> reportedUnit) {
        List<TextSpans.Span> sentences = TextSpans.sentences(text);
        TextSpans.Span sentence = TextSpans.sentenceOf(sentences, amount.start());
        List<UnitPhrase> units = sentence == null ? List.of() : findUnits(text, sentence);

        StrategyChain<TariffBinding> chain = StrategyChain.of(
                t -> nearest(amount, units, EXPLICIT_WINDOW)
                        .map(u -> PatternMatch.of(new TariffBinding(amount.value(), u.unit()),
                                ConfidenceTier.HIGH, amount.start(), "explicit")),
                t -> nearest(amount, units, Integer.MAX_VALUE)
                        .map(u -> PatternMatch.of(new TariffBinding(amount.value(), u.unit()),
                                ConfidenceTier.MEDIUM, amount.start(), "inferred")),
                t -> reportedUnit
                        .map(unit -> PatternMatch.of(new TariffBinding(amount.value(), unit),
                                ConfidenceTier.MEDIUM, amount.start(), "candidate-unit")),
                t -> Optional.of(PatternMatch.of(new TariffBinding(amount.value(), TariffUnit.UNSPECIFIED),
                        ConfidenceTier.LOW, amount.start(), "absent")));
        return chain.first(text).orElseThrow();
    }

    /**
     * Folds the per-amount bindings into the row's tariff. Repeats of one amount agree; a
     * repeat that lacks a unit defers to the one that has it.
     */
    private static TariffExtraction resolve(List<PatternMatch<TariffBinding>> bindings) {
        if (bindings.isEmpty()) {
            return TariffExtraction.none();
        }
        Map<BigDecimal, Set<TariffUnit>> unitsByValue = new TreeMap<>();
        for (PatternMatch<TariffBinding> b : bindings) {
            unitsByValue.computeIfAbsent(b.value().value(), v -> EnumSet.noneOf(TariffUnit.class))
                    .add(b.value().unit());
        }
        for (Set<TariffUnit> units : unitsByValue.values()) {
            if (units.size() > 1) {
                units.remove(TariffUnit.UNSPECIFIED);
            }
        }

        PatternMatch<TariffBinding> first = bindings.get(0);
        if (unitsByValue.size() == 1 && unitsByValue.values().iterator().next().size() == 1) {
            BigDecimal value = unitsByValue.keySet().iterator().next();
            TariffUnit unit = unitsByValue.get(value).iterator().next();
            List<PatternMatch<TariffBinding>> agreeing = bindings.stream()
                    .filter(b -> b.value().unit() == unit)
                    .toList();
            ConfidenceTier confidence = ConfidenceTier.weakest(
                    agreeing.stream().map(PatternMatch::confidence).toArray(ConfidenceTier[]::new));
            return new TariffExtraction(new TariffBinding(value, unit), confidence, first.anchor(),
                    agreeing.get(0).strategy(), List.of());
        }

        List<TariffBinding> rejected = new ArrayList<>();
        unitsByValue.forEach((value, units) -> units.forEach(unit -> rejected.add(new TariffBinding(value, unit))));
        log.debug("Ambiguous tariff {}, rejecting", rejected);
        return new TariffExtraction(null, ConfidenceTier.LOW, first.anchor(), "ambiguous", List.copyOf(rejected));
    }

    /** The one billing unit the extractor reported, empty when it reported none or several. */
    static Optional<TariffUnit> reportedUnit(List<String> candidateUnits) {
        Set<TariffUnit> units = EnumSet.noneOf(TariffUnit.class);
        for (String phrase : candidateUnits) {
            if (phrase == null || phrase.isBlank()) {
                continue;
            }
            String text = phrase.strip();
            UNIT_PATTERNS.forEach((unit, pattern) -> {
                if (pattern.matcher(text).find() || pattern.matcher("per " + text).find()) {
                    units.add(unit);
                }
            });
        }
        return units.size() == 1 ? Optional.of(units.iterator().next()) : Optional.empty();
    }

    static List<Amount> findAmounts(String text, Pattern pattern) {
        List<Amount> amounts = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String digits = null;
            for (int g = 1; g <= m.groupCount() && digits == null; g++) {
                digits = m.group(g);
            }
            if (digits == null) {
                continue;
            }
            try {
                BigDecimal value = new BigDecimal(digits.replace(",", "")).stripTrailingZeros();
                amounts.add(new Amount(value.scale() < 0 ? value.setScale(0) : value, m.start(), m.end()));
            } catch (NumberFormatException e) {
                log.debug("Skipping unparseable amount '{}'", digits);
            }
        }
        return amounts;
    }

    private static List<UnitPhrase> findUnits(String text, TextSpans.Span sentence) {
        String region = text.substring(sentence.start(), sentence.end());
        List<UnitPhrase> phrases = new ArrayList<>();
        UNIT_PATTERNS.forEach((unit, pattern) -> {
            Matcher m = pattern.matcher(region);
            while (m.find()) {
                if (LIMIT_LEAD.matcher(region.substring(Math.max(0, m.start() - 25), m.start())).find()) {
                    continue;
                }
                phrases.add(new UnitPhrase(unit, sentence.start() + m.start(), sentence.start() + m.end()));
            }
        });
        phrases.sort(Comparator.comparingInt(UnitPhrase::start).thenComparing(UnitPhrase::unit));
        return phrases;
    }

    private static Optional<UnitPhrase> nearest(Amount amount, List<UnitPhrase> units, int maxDistance) {
        return units.stream()
                .filter(u -> distance(amount, u) <= maxDistance)
                .min(Comparator.<UnitPhrase>comparingInt(u -> distance(amount, u))
                        .thenComparingInt(UnitPhrase::start));
    }

    private static int distance(Amount amount, UnitPhrase unit) {
        if (unit.start() >= amount.end()) {
            return unit.start() - amount.end();
        }
        if (amount.start() >= unit.end()) {
            return amount.start() - unit.end();
        }
        return 0;
    }
}
