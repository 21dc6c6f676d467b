package com.deepansh.memgraph.search;

import com.deepansh.memgraph.config.MemoryProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Lexical relevance of a text to a query, plus the snippet shown for a hit.
 *
 * <pre>
 * full query occurs in text -> 1.0
 * otherwise                 -> min(1, exact/n + 0.5 * partial/n)
 * </pre>
 * exact counts query words occurring anywhere in the text, partial counts
 * query words contained in some whitespace-separated word of the text, and
 * n is the number of query words. Matching is case-insensitive.
 */
@Component
public class KeywordScorer {

    private static final String ELLIPSIS = "...";

    private final int snippetLength;

    public KeywordScorer(MemoryProperties properties) {
        this.snippetLength = properties.getSearch().getSnippetLength();
    }

    public double score(String text, String query) {
        if (text == null || query == null || query.isBlank()) {
            return 0.0;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        String needle = query.toLowerCase(Locale.ROOT).strip();
        if (haystack.contains(needle)) {
            return 1.0;
        }

        String[] queryWords = needle.split("\\s+");
        String[] textWords = haystack.isBlank() ? new String[0] : haystack.strip().split("\\s+");
        int exact = 0;
        int partial = 0;
        for (String word : queryWords) {
            if (haystack.contains(word)) {
                exact++;
            }
            for (String textWord : textWords) {
                if (textWord.contains(word)) {
                    partial++;
                    break;
                }
            }
        }
        double n = queryWords.length;
        return Math.min(1.0, exact / n + 0.5 * partial / n);
    }

    /**
     * A window of the configured length centred on the first occurrence of the
     * query (or else of its first occurring word), with "..." marking cut ends.
     * Without any match the head of the content is returned.
     */
    public String snippet(String content, String query) {
        if (content == null) {
            return "";
        }
        String lower = content.toLowerCase(Locale.ROOT);
        // lowercasing can change length for a few code points; fall back to the lowered text then
        String base = lower.length() == content.length() ? content : lower;
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT).strip();

        int pos = needle.isEmpty() ? -1 : lower.indexOf(needle);
        if (pos < 0 && !needle.isEmpty()) {
            for (String word : needle.split("\\s+")) {
                pos = lower.indexOf(word);
                if (pos >= 0) break;
            }
        }

        if (pos < 0) {
            return base.length() > snippetLength ? base.substring(0, snippetLength) + ELLIPSIS : base;
        }

        int half = snippetLength / 2;
        int start = Math.max(0, pos - half);
        int end = Math.min(base.length(), pos + half);
        String snippet = base.substring(start, end);
        if (start > 0) snippet = ELLIPSIS + snippet;
        if (end < base.length()) snippet = snippet + ELLIPSIS;
        return snippet;
    }
}
