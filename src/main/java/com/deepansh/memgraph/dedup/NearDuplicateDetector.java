package com.deepansh.memgraph.dedup;

import com.deepansh.memgraph.config.MemoryProperties;
import com.deepansh.memgraph.model.Fact;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fuzzy duplicate check used at write time.
 *
 * Independent of the fingerprint index: two facts are near-duplicates when
 * they are equal ignoring case, or when the words they share cover more than
 * the threshold (0.8) of the smaller word set. Only active facts count.
 */
@Component
public class NearDuplicateDetector {

    private final double threshold;

    public NearDuplicateDetector(MemoryProperties properties) {
        this.threshold = properties.getDedup().getNearDuplicateThreshold();
    }

    public Optional<Fact> findNearDuplicate(String candidate, List<Fact> existingFacts) {
        return existingFacts.stream()
                .filter(Fact::isActive)
                .filter(f -> f.getFact() != null)
                .filter(f -> isNearDuplicate(candidate, f.getFact()))
                .findFirst();
    }

    public boolean isNearDuplicate(String a, String b) {
        String left = a.toLowerCase(Locale.ROOT).strip();
        String right = b.toLowerCase(Locale.ROOT).strip();
        if (left.equals(right)) {
            return true;
        }
        Set<String> leftWords = words(left);
        Set<String> rightWords = words(right);
        if (leftWords.isEmpty() || rightWords.isEmpty()) {
            return false;
        }
        return overlap(leftWords, rightWords) > threshold;
    }

    /** |A ∩ B| / min(|A|, |B|) */
    static double overlap(Set<String> a, Set<String> b) {
        Set<String> shared = new HashSet<>(a);
        shared.retainAll(b);
        return (double) shared.size() / Math.min(a.size(), b.size());
    }

    private static Set<String> words(String text) {
        if (text.isEmpty()) return Set.of();
        return new HashSet<>(Arrays.asList(text.split("\\s+")));
    }
}
