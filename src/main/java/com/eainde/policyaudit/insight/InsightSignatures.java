package com.eainde.policyaudit.insight;

import com.eainde.policyaudit.model.Contradiction;
import com.eainde.policyaudit.model.FindingType;
import com.eainde.policyaudit.model.Gap;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical signatures for findings. Identical findings always produce identical signatures,
 * so re-running the same rule set only flips NEW to RECURRING.
 *
 * <pre>
 * contradiction: CONTRADICTION:sha1("limit|dialysis:hemodialysis|per_week|3 vs 2 per_week")
 * gap:           GAP:sha1("stroke rehabilitation|no_coverage_found")
 * </pre>
 */
public class InsightSignatures {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}|:_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ObjectMapper objectMapper;

    public InsightSignatures(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InsightCandidate candidate(Contradiction contradiction) {
        String subject = normalize(String.join("|",
                contradiction.type().name(),
                contradiction.serviceKey(),
                contradiction.unit() == null ? "" : contradiction.unit()));
        String description = subject + "|" + normalize(contradiction.details());
        return new InsightCandidate(FindingType.CONTRADICTION, description,
                signature(FindingType.CONTRADICTION, description), toJson(contradiction), subject);
    }

    public InsightCandidate candidate(Gap gap) {
        String description = normalize(gap.condition() + "|" + gap.status().name());
        return new InsightCandidate(FindingType.GAP, description,
                signature(FindingType.GAP, description), toJson(gap), null);
    }

    public static String signature(FindingType type, String normalizedDescription) {
        return type.name() + ":" + DigestUtils.sha1Hex(normalizedDescription);
    }

    /** Lower-cases, strips punctuation other than field separators, collapses whitespace. */
    public static String normalize(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lower).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").strip();
    }

    private JsonNode toJson(Object finding) {
        return objectMapper.valueToTree(finding);
    }
}
