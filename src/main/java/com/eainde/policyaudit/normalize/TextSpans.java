package com.eainde.policyaudit.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence segmentation that keeps character offsets, so positional binding
 * can check whether two matches share a sentence.
 */
final class TextSpans {

    /** Newlines, semicolons, and a period or '!'/'?' followed by an upper-case start. */
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("\\n+|;\\s*|(?<=[.!?])\\s+(?=[A-Z(])");

    record Span(int start, int end) {
        boolean contains(int offset) {
            return offset >= start && offset < end;
        }
    }

    private TextSpans() {
    }

    static List<Span> sentences(String text) {
        List<Span> spans = new ArrayList<>();
        Matcher m = SENTENCE_BOUNDARY.matcher(text);
        int start = 0;
        while (m.find()) {
            if (m.start() > start) {
                spans.add(new Span(start, m.start()));
            }
            start = m.end();
        }
        if (start < text.length()) {
            spans.add(new Span(start, text.length()));
        }
        return spans;
    }

    static Span sentenceOf(List<Span> sentences, int offset) {
        for (Span span : sentences) {
            if (span.contains(offset)) {
                return span;
            }
        }
        return null;
    }

    static String collapseWhitespace(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").strip();
    }
}
