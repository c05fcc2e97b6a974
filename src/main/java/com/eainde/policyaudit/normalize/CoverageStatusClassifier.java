package com.eainde.policyaudit.normalize;

import com.eainde.policyaudit.model.ConfidenceTier;
import com.eainde.policyaudit.model.CoverageStatus;

import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a rule as INCLUDED or EXCLUDED.
 *
 * <p>Guard phrases that merely look negative ("not exceeding", "no co-payment") are masked
 * before the negative patterns run. Positive phrasing such as "covered at Level 4-6" never
 * produces an exclusion on its own.</p>
 */
public class CoverageStatusClassifier {

    private static final List<Pattern> GUARDS = List.of(
            Pattern.compile("(?i)\\bnot\\s+(?:only|exceed(?:ing)?|more\\s+than|less\\s+than|later\\s+than)\\b"),
            Pattern.compile("(?i)\\bno\\s+(?:co-?\\s?pay(?:ments?)?|waiting\\s+period|limit|referral\\s+(?:is\\s+)?required)\\b"));

    private static final List<Pattern> NEGATIVE = List.of(
            Pattern.compile("(?i)\\bnot\\s+covered\\b"),
            Pattern.compile("(?i)\\bexcluded\\b"),
            Pattern.compile("(?i)\\bnot\\s+(?:payable|reimbursable|billable)\\b"),
            Pattern.compile("(?i)\\bno\\s+(?:coverage|reimbursement)\\b"),
            Pattern.compile("(?i)\\bshall\\s+not\\s+be\\s+(?:covered|reimbursed|paid)\\b"),
            Pattern.compile("(?i)\\bnot\\s+included\\s+in\\s+(?:the\\s+)?benefits?\\b"),
            Pattern.compile("(?i)\\bout\\s+of\\s+scope\\b"),
            Pattern.compile("(?i)\\b(?:not\\s+available|unavailable)\\s+(?:at|in)\\s+levels?\\b"),
            Pattern.compile("(?i)\\b(?:except|excluding)\\s+(?:at\\s+|in\\s+)?levels?\\s*\\d"));

    private static final Pattern POSITIVE = Pattern.compile(
            "(?i)\\b(?:covered|included|payable|reimbursable|available)\\b");

    /** Level phrase that follows an exclusion: "not covered at Level 2 and 3". */
    private static final Pattern EXCLUDED_AFTER = Pattern.compile(
            "(?i)\\b(?:not\\s+covered|excluded|not\\s+available|unavailable|not\\s+payable|except|excluding)"
                    + "\\s+(?:(?:at|in|for)\\s+)?(" + FacilityLevelCanonicalizer.LEVEL_PHRASE + ")");

    /** Level phrase that precedes an exclusion: "Level 2 facilities: not covered". */
    private static final Pattern EXCLUDED_BEFORE = Pattern.compile(
            "(?i)\\b(" + FacilityLevelCanonicalizer.LEVEL_PHRASE + ")"
                    + "\\s*(?:facilities\\s*)?:?\\s*(?:are\\s+|is\\s+)?(?:not\\s+covered|excluded)\\b");

    private final StrategyChain<CoverageStatus> chain;
    private final FacilityLevelCanonicalizer levels;

    public CoverageStatusClassifier(FacilityLevelCanonicalizer levels) {
        this.levels = levels;
        this.chain = StrategyChain.of(
                text -> firstMatch(text, NEGATIVE)
                        .map(at -> PatternMatch.of(CoverageStatus.EXCLUDED, ConfidenceTier.HIGH, at, "negative")),
                text -> firstMatch(text, List.of(POSITIVE))
                        .map(at -> PatternMatch.of(CoverageStatus.INCLUDED, ConfidenceTier.HIGH, at, "positive")),
                text -> Optional.of(PatternMatch.of(CoverageStatus.INCLUDED, ConfidenceTier.MEDIUM, -1, "default")));
    }

    /** Always returns a match; a row with no coverage wording defaults to INCLUDED at MEDIUM. */
    public PatternMatch<CoverageStatus> classify(String rawText) {
        String masked = mask(rawText == null ? "" : rawText);
        if (masked.isBlank()) {
            return PatternMatch.of(CoverageStatus.INCLUDED, ConfidenceTier.MEDIUM, -1, "default");
        }
        return chain.first(masked).orElseThrow();
    }

    /**
     * Levels an exclusion is scoped to, such as {2, 3} for "not covered at Level 2 and 3".
     * Empty when the exclusion is not level specific.
     */
    public SortedSet<Integer> excludedLevels(String rawText) {
        SortedSet<Integer> excluded = new TreeSet<>();
        if (rawText == null) {
            return excluded;
        }
        String masked = mask(rawText);
        for (Pattern pattern : List.of(EXCLUDED_AFTER, EXCLUDED_BEFORE)) {
            Matcher m = pattern.matcher(masked);
            while (m.find()) {
                excluded.addAll(levels.explicitIn(m.group(1)));
            }
        }
        return excluded;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    /** Replaces guard phrases with spaces of the same length so offsets stay valid. */
    static String mask(String text) {
        String masked = text;
        for (Pattern guard : GUARDS) {
            Matcher m = guard.matcher(masked);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                m.appendReplacement(sb, " ".repeat(m.end() - m.start()));
            }
            m.appendTail(sb);
            masked = sb.toString();
        }
        return masked;
    }

    private static Optional<Integer> firstMatch(String text, List<Pattern> patterns) {
        int first = -1;
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            if (m.find() && (first < 0 || m.start() < first)) {
                first = m.start();
            }
        }
        return first < 0 ? Optional.empty() : Optional.of(first);
    }
}
