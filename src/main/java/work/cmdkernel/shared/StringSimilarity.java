package work.cmdkernel.shared;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Edit-distance helpers behind "did you mean" suggestions.
 */
public final class StringSimilarity {
    public static final int DEFAULT_MAX_DISTANCE = 2;
    public static final int DEFAULT_MAX_RESULTS = 3;

    private StringSimilarity() {}

    /**
     * Case-insensitive Levenshtein distance.
     */
    public static int levenshtein(String left, String right) {
        var a = left == null ? "" : left.toLowerCase(Locale.ROOT);
        var b = right == null ? "" : right.toLowerCase(Locale.ROOT);
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            var swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    public static List<String> findSimilar(String input, Iterable<String> candidates) {
        return findSimilar(input, candidates, DEFAULT_MAX_DISTANCE, DEFAULT_MAX_RESULTS);
    }

    /**
     * Candidates within {@code maxDistance} of the input, closest first, ties in lexical order.
     */
    public static List<String> findSimilar(String input, Iterable<String> candidates, int maxDistance, int maxResults) {
        if (input == null || input.isEmpty() || candidates == null || maxResults <= 0) {
            return List.of();
        }
        var scored = new ArrayList<Scored>();
        var seen = new HashSet<String>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isEmpty() || !seen.add(candidate)) {
                continue;
            }
            int distance = levenshtein(input, candidate);
            if (distance <= maxDistance) {
                scored.add(new Scored(candidate, distance));
            }
        }
        scored.sort(Comparator.comparingInt(Scored::distance).thenComparing(Scored::candidate));
        var result = new ArrayList<String>();
        for (Scored entry : scored) {
            if (result.size() >= maxResults) {
                break;
            }
            result.add(entry.candidate());
        }
        return List.copyOf(result);
    }

    public static Optional<String> findMostSimilar(String input, Iterable<String> candidates) {
        return findMostSimilar(input, candidates, 3);
    }

    public static Optional<String> findMostSimilar(String input, Iterable<String> candidates, int maxDistance) {
        var found = findSimilar(input, candidates, maxDistance, 1);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private record Scored(String candidate, int distance) {}
}
