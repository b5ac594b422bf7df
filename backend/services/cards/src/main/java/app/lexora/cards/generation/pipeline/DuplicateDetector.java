package app.lexora.cards.generation.pipeline;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Exact-then-fuzzy duplicate check of a normalized key against a deck's key set.
 * The fuzzy score is the larger of the normalized Levenshtein similarity and the token Jaccard
 * index; a score equal to the threshold counts as a duplicate.
 */
public class DuplicateDetector {

    private static final double EPSILON = 1e-9d;

    private final double threshold;

    public DuplicateDetector(double threshold) {
        if (threshold <= 0d || threshold > 1d) {
            throw new IllegalArgumentException("Similarity threshold must be in (0, 1]: " + threshold);
        }
        this.threshold = threshold;
    }

    public boolean isDuplicate(NormalizedKey key, Set<NormalizedKey> existingKeys) {
        return findMatch(key, existingKeys).isPresent();
    }

    public Optional<Match> findMatch(NormalizedKey key, Set<NormalizedKey> existingKeys) {
        if (key == null || key.isEmpty() || existingKeys == null || existingKeys.isEmpty()) {
            return Optional.empty();
        }
        if (existingKeys.contains(key)) {
            return Optional.of(new Match(key, 1d));
        }
        for (NormalizedKey existing : existingKeys) {
            if (existing == null || existing.isEmpty()) {
                continue;
            }
            double score = similarity(key, existing);
            if (score + EPSILON >= threshold) {
                return Optional.of(new Match(existing, score));
            }
        }
        return Optional.empty();
    }

    public double similarity(NormalizedKey a, NormalizedKey b) {
        if (a.equals(b)) {
            return 1d;
        }
        return Math.max(editSimilarity(a.value(), b.value()), tokenJaccard(a.tokens(), b.tokens()));
    }

    private double editSimilarity(String a, String b) {
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1d;
        }
        int lengthGap = Math.abs(a.length() - b.length());
        if ((maxLength - lengthGap) / (double) maxLength + EPSILON < threshold) {
            return 0d;
        }
        return (maxLength - levenshtein(a, b)) / (double) maxLength;
    }

    private int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private double tokenJaccard(List<String> a, List<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0d;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(new HashSet<>(b));
        return intersection.size() / (double) union.size();
    }

    public record Match(NormalizedKey existing, double score) {
    }
}
