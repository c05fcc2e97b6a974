package com.eainde.policyaudit.normalize;

import com.eainde.policyaudit.model.ConfidenceTier;
import com.eainde.policyaudit.model.LimitType;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts utilization limits ("3 sessions per week", "twice a month", "up to 30 days").
 *
 * <p>A line that states two different values for the same window is ambiguous: that window
 * is dropped rather than picking one, and the extraction is reported as LOW. A count too large
 * to read is treated the same way.</p>
 */
@Slf4j
public class LimitExtractor {

    private static final String COUNT_NOUN = "(?:sessions?|times?|visits?|treatments?|cycles?|admissions?|days?|x)";
    private static final String PER = "(?:per|a|an|each|every|/)";

    private static final Map<String, Integer> WORD_COUNTS = Map.of("once", 1, "twice", 2, "thrice", 3);

    private static final Map<LimitType, List<Pattern>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(LimitType.PER_WEEK, windowPatterns("week", "weekly"));
        PATTERNS.put(LimitType.PER_MONTH, windowPatterns("month", "monthly"));
        PATTERNS.put(LimitType.PER_YEAR, windowPatterns("(?:year|annum)", "(?:annually|yearly)"));
        PATTERNS.put(LimitType.MAX_TOTAL, List.of(Pattern.compile(
                "(?i)\\b(?:up\\s*to|max(?:imum)?(?:\\s+of)?|not\\s+exceeding|limited\\s+to)\\s*(\\d+)\\s*"
                        + "(?:sessions?|days?|visits?|treatments?|times?|admissions?|cycles?)\\b"
                        + "(?!\\s*" + PER + "\\s*(?:week|month|year|annum))"
                        + "(?!\\s*(?:weekly|monthly|annually|yearly))")));
    }

    private static List<Pattern> windowPatterns(String window, String adverb) {
        return List.of(
                Pattern.compile("(?i)\\b(\\d+)\\s*" + COUNT_NOUN + "\\s*" + PER + "\\s*" + window + "\\b"),
                Pattern.compile("(?i)\\b(\\d+)\\s*" + COUNT_NOUN + "\\s*" + adverb + "\\b"),
                Pattern.compile("(?i)\\b" + adverb + "\\s*(?:limit\\s*(?:of\\s*)?)?(\\d+)\\s*" + COUNT_NOUN + "\\b"),
                Pattern.compile("(?i)\\b(once|twice|thrice)\\s*(?:" + PER + "\\s*" + window + "|" + adverb + ")\\b"));
    }

    /**
     * Extraction outcome for one row.
     *
     * @param limits     unambiguous limits by window
     * @param confidence HIGH when every window found was unambiguous, LOW otherwise
     * @param rejected   windows dropped because the row stated conflicting values
     * @param anchor     offset of the first limit phrase, -1 when none
     */
    public record LimitExtraction(Map<LimitType, Integer> limits, ConfidenceTier confidence,
                                  Set<LimitType> rejected, int anchor) {

        public boolean isEmpty() {
            return limits.isEmpty() && rejected.isEmpty();
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Reads limits from the raw text, falling back to the extractor's candidate phrases
     * when the text has none.
     */
    public LimitExtraction extract(String rawText, List<String> candidatePhrases) {
        LimitExtraction fromText = extract(rawText);
        if (!fromText.isEmpty() || candidatePhrases.isEmpty()) {
            return fromText;
        }
        LimitExtraction fromCandidates = extract(String.join("\n", candidatePhrases));
        return new LimitExtraction(fromCandidates.limits(), fromCandidates.confidence(),
                fromCandidates.rejected(), -1);
    }

    LimitExtraction extract(String text) {
        Map<LimitType, Integer> limits = new EnumMap<>(LimitType.class);
        Set<LimitType> rejected = new TreeSet<>();
        int anchor = -1;
        if (text == null || text.isBlank()) {
            return new LimitExtraction(limits, ConfidenceTier.LOW, rejected, anchor);
        }
        for (Map.Entry<LimitType, List<Pattern>> entry : PATTERNS.entrySet()) {
            Set<Integer> values = new TreeSet<>();
            boolean unreadable = false;
            for (Pattern pattern : entry.getValue()) {
                Matcher m = pattern.matcher(text);
                while (m.find()) {
                    Integer count = toCount(m.group(1));
                    if (count == null) {
                        unreadable = true;
                    } else {
                        values.add(count);
                    }
                    if (anchor < 0 || m.start() < anchor) anchor = m.start();
                }
            }
            if (unreadable) {
                log.debug("Unreadable {} limit in '{}', rejecting", entry.getKey(), text);
                rejected.add(entry.getKey());
            } else if (values.size() == 1) {
                limits.put(entry.getKey(), values.iterator().next());
            } else if (values.size() > 1) {
                log.debug("Ambiguous {} limit {} in '{}', rejecting", entry.getKey(), values, text);
                rejected.add(entry.getKey());
            }
        }
        ConfidenceTier confidence = rejected.isEmpty() ? ConfidenceTier.HIGH : ConfidenceTier.LOW;
        return new LimitExtraction(limits, confidence, rejected, anchor);
    }

    /** Count for a digit or word token, null when the digits do not fit an int. */
    private static Integer toCount(String token) {
        Integer word = WORD_COUNTS.get(token.toLowerCase());
        if (word != null) {
            return word;
        }
        try {
            return Integer.valueOf(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
