package com.eainde.policyaudit.normalize;

/**
 * Builds the evidence excerpt attached to every rule: whitespace collapsed, the full row when
 * it is short enough, otherwise a window around the anchor of the most relevant match.
 */
public final class EvidenceSnippets {

    public static final int DEFAULT_MAX_LENGTH = 300;
    public static final int DEFAULT_MIN_LENGTH = 150;

    private static final String ELLIPSIS = "...";

    private final int minLength;
    private final int maxLength;

    public EvidenceSnippets(int minLength, int maxLength) {
        if (minLength <= 0 || maxLength < minLength) {
            throw new IllegalArgumentException(
                    "snippet lengths must satisfy 0 < min (" + minLength + ") <= max (" + maxLength + ")");
        }
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public EvidenceSnippets() {
        this(DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH);
    }

    /**
     * @param rawText source row
     * @param anchor  offset in {@code rawText} to centre on, or -1 to take the start
     */
    public String snippet(String rawText, int anchor) {
        if (rawText == null || rawText.isBlank()) {
            return "";
        }
        String collapsed = TextSpans.collapseWhitespace(rawText);
        if (collapsed.length() <= maxLength) {
            return collapsed;
        }
        // anchor was measured on the raw text; map it proportionally onto the collapsed one
        int centre = anchor < 0 ? 0 : (int) ((long) anchor * collapsed.length() / rawText.length());
        int start = Math.max(0, centre - maxLength / 2);
        int end = Math.min(collapsed.length(), start + maxLength);
        start = Math.max(0, Math.min(start, end - maxLength));

        StringBuilder sb = new StringBuilder();
        if (start > 0) sb.append(ELLIPSIS);
        sb.append(collapsed, start, end);
        if (end < collapsed.length()) sb.append(ELLIPSIS);
        return sb.toString();
    }

    public int minLength() {
        return minLength;
    }

    public int maxLength() {
        return maxLength;
    }
}
