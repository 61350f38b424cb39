package com.groundgate.core.citation;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical relevance between an answer and a chunk: shared tokens over the union of
 * both token sets (Jaccard overlap), in [0, 1].
 * <p>
 * Tokens are lower-cased with {@link Locale#ROOT}, split on Unicode whitespace, and stripped of
 * leading and trailing characters that are neither letters nor digits. Scripts written
 * without spaces form one token per run.
 */
public final class RelevanceScorer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private RelevanceScorer() {}

    public static Set<String> tokenize(String text) {
        var tokens = new LinkedHashSet<String>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String raw : WHITESPACE.split(text.toLowerCase(Locale.ROOT))) {
            String token = trimNonAlphanumeric(raw);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static double overlap(String answer, String chunkText) {
        return overlap(tokenize(answer), tokenize(chunkText));
    }

    static double overlap(Set<String> answerTokens, Set<String> chunkTokens) {
        if (answerTokens.isEmpty() || chunkTokens.isEmpty()) {
            return 0.0;
        }
        var shared = new HashSet<>(answerTokens);
        shared.retainAll(chunkTokens);
        var union = new HashSet<>(answerTokens);
        union.addAll(chunkTokens);
        return (double) shared.size() / union.size();
    }

    private static String trimNonAlphanumeric(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end && !Character.isLetterOrDigit(raw.codePointAt(start))) {
            start += Character.charCount(raw.codePointAt(start));
        }
        while (end > start && !Character.isLetterOrDigit(raw.codePointBefore(end))) {
            end -= Character.charCount(raw.codePointBefore(end));
        }
        return raw.substring(start, end);
    }
}
