package com.eainde.policyaudit.normalize;

import com.eainde.policyaudit.model.ConfidenceTier;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns facility mentions ("Level 4-6", "Levels II and III", "Tier 3", "dispensary")
 * into a sorted set of integer levels within the configured range.
 *
 * <p>Explicit level numbers win over facility-type synonyms. Numbers outside
 * {@code [minLevel, maxLevel]} are dropped, never clamped.</p>
 */
@Slf4j
public class FacilityLevelCanonicalizer {

    private static final String LEVEL_TOKEN = "(?:\\d{1,2}|vi|iv|v|i{1,3})\\b";
    private static final String LEVEL_WORD = "(?:levels?|lvl\\.?|tiers?)";

    /** "Level 4", "Levels 2, 3 and 4", "Level IV-VI", "Tier 3 to Tier 5". */
    static final String LEVEL_PHRASE = LEVEL_WORD + "\\s*(" + LEVEL_TOKEN
            + "(?:\\s*(?:-|–|to|and|&|,|or)\\s*(?:" + LEVEL_WORD + "\\s*)?" + LEVEL_TOKEN + ")*)";

    private static final Pattern EXPLICIT = Pattern.compile("(?i)\\b" + LEVEL_PHRASE);

    /** Compact "L4" form; case sensitive to stay clear of ordinary words. */
    private static final Pattern COMPACT = Pattern.compile("\\bL(\\d)\\b");

    /** A whole mention that is nothing but a level list ("4-6", "IV", "2 and 3"). */
    private static final Pattern BARE_LIST = Pattern.compile("(?i)^\\s*(" + LEVEL_TOKEN
            + "(?:\\s*(?:-|–|to|and|&|,|or)\\s*" + LEVEL_TOKEN + ")*)\\s*$");

    private static final Pattern LEVEL_PART = Pattern.compile("(?i)(\\d{1,2}|vi|iv|v|i{1,3})\\b|(-|–|\\bto\\b)");

    private static final Map<String, Integer> ROMAN = Map.of(
            "i", 1, "ii", 2, "iii", 3, "iv", 4, "v", 5, "vi", 6);

    private static final Map<Pattern, Set<Integer>> SYNONYMS = new LinkedHashMap<>();

    static {
        SYNONYMS.put(Pattern.compile("(?i)\\bdispensar(?:y|ies)\\b"), Set.of(2));
        SYNONYMS.put(Pattern.compile("(?i)\\bhealth\\s+cent(?:re|er)s?\\b"), Set.of(3));
        SYNONYMS.put(Pattern.compile("(?i)\\bsub[-\\s]county\\s+(?:referral\\s+)?hospitals?\\b"), Set.of(4));
        SYNONYMS.put(Pattern.compile("(?i)(?<!sub-)(?<!sub )\\bcounty\\s+referral\\b"), Set.of(5));
        SYNONYMS.put(Pattern.compile("(?i)\\bnational\\s+referral\\b"), Set.of(6));
        SYNONYMS.put(Pattern.compile("(?i)\\bprimary\\s+(?:health\\s*)?care\\b"), Set.of(1, 2, 3));
        SYNONYMS.put(Pattern.compile("(?i)\\bcommunity\\s+(?:health\\s+)?(?:unit|level)s?\\b"), Set.of(1));
    }

    private final int minLevel;
    private final int maxLevel;
    private final StrategyChain<SortedSet<Integer>> chain;
    private final StrategyChain<SortedSet<Integer>> mentionChain;

    public FacilityLevelCanonicalizer(int minLevel, int maxLevel) {
        if (minLevel < 0 || maxLevel < minLevel) {
            throw new IllegalArgumentException(
                    "Invalid facility level range [" + minLevel + ", " + maxLevel + "]");
        }
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
        this.chain = StrategyChain.of(this::explicitLevels, this::synonymLevels);
        this.mentionChain = StrategyChain.of(this::explicitLevels, this::synonymLevels, this::bareLevels);
    }

    public FacilityLevelCanonicalizer() {
        this(1, 6);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Canonicalizes the raw text; when it has no facility mention, the extractor's
     * candidate mentions are tried in order. A mention is already known to be facility
     * text, so a bare level list such as "4-6" is accepted there but never in the row.
     */
    public Optional<PatternMatch<SortedSet<Integer>>> canonicalize(String rawText, List<String> candidateMentions) {
        Optional<PatternMatch<SortedSet<Integer>>> fromText = chain.first(rawText);
        if (fromText.isPresent()) {
            return fromText;
        }
        for (String mention : candidateMentions) {
            Optional<PatternMatch<SortedSet<Integer>>> fromMention = mentionChain.first(mention);
            if (fromMention.isPresent()) {
                return Optional.of(PatternMatch.of(fromMention.get().value(), fromMention.get().confidence(),
                        -1, "candidate-" + fromMention.get().strategy()));
            }
        }
        return Optional.empty();
    }

    /** Levels named explicitly in a phrase, ignoring synonyms. Empty when there are none. */
    public SortedSet<Integer> explicitIn(String phrase) {
        return explicitLevels(phrase).map(PatternMatch::value).orElseGet(TreeSet::new);
    }

    public boolean isValid(int level) {
        return level >= minLevel && level <= maxLevel;
    }

    // =========================================================================
    //  Strategies
    // =========================================================================

    private Optional<PatternMatch<SortedSet<Integer>>> explicitLevels(String text) {
        SortedSet<Integer> levels = new TreeSet<>();
        int anchor = -1;
        Matcher m = EXPLICIT.matcher(text);
        while (m.find()) {
            if (anchor < 0) anchor = m.start();
            levels.addAll(parseLevelList(m.group(1)));
        }
        Matcher compact = COMPACT.matcher(text);
        while (compact.find()) {
            if (anchor < 0) anchor = compact.start();
            addIfValid(levels, Integer.parseInt(compact.group(1)));
        }
        if (levels.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PatternMatch.of(levels, ConfidenceTier.HIGH, anchor, "explicit"));
    }

    private Optional<PatternMatch<SortedSet<Integer>>> synonymLevels(String text) {
        SortedSet<Integer> levels = new TreeSet<>();
        int anchor = -1;
        for (Map.Entry<Pattern, Set<Integer>> synonym : SYNONYMS.entrySet()) {
            Matcher m = synonym.getKey().matcher(text);
            if (m.find()) {
                if (anchor < 0 || m.start() < anchor) anchor = m.start();
                synonym.getValue().forEach(level -> addIfValid(levels, level));
            }
        }
        if (levels.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PatternMatch.of(levels, ConfidenceTier.MEDIUM, anchor, "synonym"));
    }

    private Optional<PatternMatch<SortedSet<Integer>>> bareLevels(String mention) {
        Matcher m = BARE_LIST.matcher(mention);
        if (!m.matches()) {
            return Optional.empty();
        }
        SortedSet<Integer> levels = parseLevelList(m.group(1));
        if (levels.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PatternMatch.of(levels, ConfidenceTier.MEDIUM, m.start(1), "bare"));
    }

    /**
     * Walks "4 - 6", "2, 3 and 5", "II to IV": a dash or "to" between two numbers is a range,
     * anything else separates single levels.
     */
    private SortedSet<Integer> parseLevelList(String list) {
        SortedSet<Integer> levels = new TreeSet<>();
        Matcher m = LEVEL_PART.matcher(list);
        Integer previous = null;
        boolean rangePending = false;
        while (m.find()) {
            if (m.group(2) != null) {
                rangePending = previous != null;
                continue;
            }
            int level = toInt(m.group(1));
            if (rangePending && previous != null) {
                for (int l = Math.min(previous, level); l <= Math.max(previous, level); l++) {
                    addIfValid(levels, l);
                }
            } else {
                addIfValid(levels, level);
            }
            previous = level;
            rangePending = false;
        }
        return levels;
    }

    private static int toInt(String token) {
        Integer roman = ROMAN.get(token.toLowerCase());
        return roman != null ? roman : Integer.parseInt(token);
    }

    private void addIfValid(SortedSet<Integer> levels, int level) {
        if (isValid(level)) {
            levels.add(level);
        } else {
            log.debug("Dropping out-of-range facility level {} (valid {}..{})", level, minLevel, maxLevel);
        }
    }
}
