package tech.syncbridge.transform.mapping;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Drafts a mapping between two field lists by name similarity.
 *
 * <p>Every target field is paired with the most similar source field scoring at least
 * {@link #THRESHOLD}. Email and phone targets get the matching normalization function,
 * everything else an IDENTITY rule. The draft is a starting point for a human and is not
 * validated.</p>
 */
public final class MappingSuggester {

    static final double THRESHOLD = 0.5;

    private MappingSuggester() {
    }

    public static FieldMapping suggest(String name, List<String> sourceFields, List<String> targetFields) {
        List<MappingRule> rules = new ArrayList<>();
        for (String target : targetFields) {
            String best = null;
            double bestScore = 0;
            for (String source : sourceFields) {
                double score = similarity(source, target);
                if (score > bestScore) {
                    bestScore = score;
                    best = source;
                }
            }
            if (best != null && bestScore >= THRESHOLD) {
                rules.add(ruleFor(best, target));
            }
        }
        return new FieldMapping(name, rules, List.of());
    }

    /**
     * Similarity in [0, 1]: 1 for equal normalized names, 0.8 when one contains the other,
     * otherwise the Jaccard index of their word sets.
     */
    static double similarity(String a, String b) {
        String na = normalize(a);
        String nb = normalize(b);
        if (na.isEmpty() || nb.isEmpty()) {
            return 0;
        }
        if (na.equals(nb)) {
            return 1.0;
        }
        if (na.contains(nb) || nb.contains(na)) {
            return 0.8;
        }
        Set<String> wa = words(a);
        Set<String> wb = words(b);
        Set<String> union = new HashSet<>(wa);
        union.addAll(wb);
        wa.retainAll(wb);
        return union.isEmpty() ? 0 : (double) wa.size() / union.size();
    }

    private static MappingRule ruleFor(String source, String target) {
        String lower = target.toLowerCase(Locale.ROOT);
        if (lower.contains("email")) {
            return MappingRule.function(source, target, "normalize_email");
        }
        if (lower.contains("phone")) {
            return MappingRule.function(source, target, "normalize_phone");
        }
        return MappingRule.identity(source, target, null);
    }

    // Last path segment only, without separators
    private static String normalize(String field) {
        String last = field.substring(field.lastIndexOf('.') + 1);
        return last.replaceAll("[^A-Za-z0-9]", "").toLowerCase(Locale.ROOT);
    }

    private static Set<String> words(String field) {
        String last = field.substring(field.lastIndexOf('.') + 1);
        String spaced = last.replaceAll("([a-z0-9])([A-Z])", "$1 $2").replaceAll("[^A-Za-z0-9]+", " ");
        Set<String> words = new HashSet<>();
        Arrays.stream(spaced.toLowerCase(Locale.ROOT).trim().split(" "))
            .filter(w -> !w.isEmpty())
            .forEach(words::add);
        return words;
    }
}
