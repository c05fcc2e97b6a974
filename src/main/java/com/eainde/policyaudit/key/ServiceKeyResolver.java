package com.eainde.policyaudit.key;

import com.eainde.policyaudit.model.Rule;
import com.eainde.policyaudit.model.ServiceCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Derives the canonical service key that groups equivalent services across the document.
 *
 * <h3>Key shape:</h3>
 * <pre>
 * "Haemodialysis session"      → dialysis:hemodialysis
 * "HD (per session)"           → dialysis:hemodialysis
 * "Caesarean section delivery" → maternity:caesarean_section_delivery
 * </pre>
 *
 * <p>Keys are prefixed with the service category, so services of different categories never
 * merge. Within a category, spelling variants whose token part is at least
 * {@code similarityThreshold} similar collapse onto one canonical key. Variants are processed
 * in lexical order, so the outcome does not depend on row order.</p>
 *
 * <p>A description with no usable service token gets the {@value #UNRESOLVED} token part. That
 * key names no service: it never absorbs other variants, and rules carrying it are never
 * compared with each other.</p>
 */
@Slf4j
public class ServiceKeyResolver {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.80;

    private static final int MAX_TOKENS = 4;
    public static final String UNRESOLVED = "general";

    /** Abbreviations and spelling variants, applied to the lower-cased description in order. */
    private static final Map<Pattern, String> VARIANTS = new LinkedHashMap<>();

    static {
        VARIANTS.put(Pattern.compile("\\bhaemo"), "hemo");
        VARIANTS.put(Pattern.compile("\\bhd\\b"), "hemodialysis");
        VARIANTS.put(Pattern.compile("\\bc-?\\s?section\\b|\\bcs\\b"), "caesarean section");
        VARIANTS.put(Pattern.compile("\\bcesarean\\b"), "caesarean");
        VARIANTS.put(Pattern.compile("\\bphysio\\b"), "physiotherapy");
        VARIANTS.put(Pattern.compile("\\bx-?\\s?rays?\\b"), "xray");
        VARIANTS.put(Pattern.compile("\\bct\\b(?!\\s*scan)"), "ct scan");
        VARIANTS.put(Pattern.compile("\\bpaediatric"), "pediatric");
        VARIANTS.put(Pattern.compile("\\btumour"), "tumor");
        VARIANTS.put(Pattern.compile("\\bcounselling\\b"), "counseling");
        VARIANTS.put(Pattern.compile("\\bcentre\\b"), "center");
        VARIANTS.put(Pattern.compile("\\bchemo\\b"), "chemotherapy");
    }

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "of", "for", "and", "or", "in", "at", "per", "each", "with", "to", "on", "by",
            "is", "are", "be", "service", "services", "cover", "covered", "coverage", "benefit", "benefits",
            "charge", "charges", "fee", "fees", "tariff", "cost", "rate", "package", "kes", "ksh", "kshs",
            "level", "levels", "tier", "session", "sessions", "day", "days", "visit", "visits", "week",
            "weekly", "month", "monthly", "year", "annual", "not", "excluded", "included", "up", "max",
            "maximum", "facility", "facilities", "only", "all");

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern NUMERIC_OR_ROMAN = Pattern.compile("\\d+|i{1,3}|iv|vi?");

    private final double similarityThreshold;

    public ServiceKeyResolver(double similarityThreshold) {
        if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException(
                    "similarityThreshold must be in (0, 1] but was " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
    }

    public ServiceKeyResolver() {
        this(DEFAULT_SIMILARITY_THRESHOLD);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /** Key of a single description, without merging against other variants. */
    public String resolve(String description, ServiceCategory category) {
        ServiceCategory effective = category == null ? ServiceCategory.OTHER : category;
        return effective.prefix() + ":" + tokenPart(description);
    }

    /**
     * Assigns keys to every rule. Rules that already carry a key keep it; the rest get the
     * canonical key of their variant group.
     */
    public List<Rule> resolveAll(List<Rule> rules) {
        Map<ServiceCategory, Set<String>> variantsByCategory = new EnumMap<>(ServiceCategory.class);
        for (Rule rule : rules) {
            if (!hasKey(rule)) {
                variantsByCategory.computeIfAbsent(rule.category(), c -> new TreeSet<>())
                        .add(tokenPart(rule.serviceDescription()));
            }
        }

        Map<String, String> canonicalByRawKey = new HashMap<>();
        variantsByCategory.forEach((category, variants) -> {
            List<String> canonicals = new ArrayList<>();
            for (String variant : variants) {
                if (UNRESOLVED.equals(variant)) {
                    continue;
                }
                String canonical = closest(variant, canonicals);
                if (canonical == null) {
                    canonicals.add(variant);
                    canonical = variant;
                } else {
                    log.debug("Merging service variant '{}' into '{}' ({})", variant, canonical, category);
                }
                canonicalByRawKey.put(category.prefix() + ":" + variant, category.prefix() + ":" + canonical);
            }
        });

        List<Rule> resolved = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            if (hasKey(rule)) {
                resolved.add(rule);
            } else {
                String raw = resolve(rule.serviceDescription(), rule.category());
                resolved.add(rule.withServiceKey(canonicalByRawKey.getOrDefault(raw, raw)));
            }
        }
        log.info("Resolved {} rules onto {} service keys (threshold {})", rules.size(),
                resolved.stream().map(Rule::serviceKey).distinct().count(), similarityThreshold);
        return resolved;
    }

    /** True for a key whose description yielded no service token. */
    public static boolean isUnresolved(String serviceKey) {
        return serviceKey != null && serviceKey.endsWith(":" + UNRESOLVED);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    String tokenPart(String description) {
        if (description == null || description.isBlank()) {
            return UNRESOLVED;
        }
        String text = description.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> variant : VARIANTS.entrySet()) {
            text = variant.getKey().matcher(text).replaceAll(variant.getValue());
        }
        List<String> tokens = new ArrayList<>();
        for (String token : NON_ALNUM.split(text)) {
            if (token.length() < 2 || STOP_WORDS.contains(token) || NUMERIC_OR_ROMAN.matcher(token).matches()) {
                continue;
            }
            tokens.add(token);
            if (tokens.size() == MAX_TOKENS) {
                break;
            }
        }
        return tokens.isEmpty() ? UNRESOLVED : String.join("_", tokens);
    }

    /** Most similar existing canonical at or above the threshold; ties go to the earlier one. */
    private String closest(String variant, List<String> canonicals) {
        String best = null;
        double bestScore = similarityThreshold;
        for (String canonical : canonicals) {
            double score = StringSimilarity.ratio(variant, canonical);
            if (score >= bestScore && (best == null || score > bestScore)) {
                best = canonical;
                bestScore = score;
            }
        }
        return best;
    }

    private static boolean hasKey(Rule rule) {
        return rule.serviceKey() != null && !rule.serviceKey().isBlank();
    }
}
