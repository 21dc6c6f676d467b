package com.deepansh.memgraph.dedup;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes text and derives its content fingerprint.
 * Two texts with the same fingerprint are duplicates by definition.
 */
@Component
public class ContentNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[.!?,;:]+");
    private static final Pattern STOP_WORDS = Pattern.compile("\\b(a|an|the|in|on|at|to|for|of|with|by)\\b");
    private static final int PREVIEW_LENGTH = 100;

    public String normalize(String text) {
        if (text == null) return "";
        String normalized = text.toLowerCase(Locale.ROOT);
        normalized = WHITESPACE.matcher(normalized.strip()).replaceAll(" ");
        normalized = PUNCTUATION.matcher(normalized).replaceAll("");
        normalized = STOP_WORDS.matcher(normalized).replaceAll("");
        // stop-word removal leaves double spaces behind
        return WHITESPACE.matcher(normalized.strip()).replaceAll(" ");
    }

    /** SHA-256 of the normalized text, lowercase hex. */
    public String fingerprint(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalize(text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Normalized text cut to 100 characters, for index entries. */
    public String preview(String text) {
        return truncate(normalize(text));
    }

    static String truncate(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
