package ai.codenav.analyzer.search;

import ai.codenav.analyzer.model.SymbolMatch;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.apache.commons.text.similarity.LevenshteinDistance;

/**
 * Case-insensitive name matching for symbol search.
 *
 * <p>A name matches if it contains the pattern, or if the pattern's characters appear in the name in order (so
 * {@code USvc} matches {@code UserService}). Matches rank exact hits first, then by edit distance to the pattern.
 */
public final class NameMatcher {
    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private final String pattern;
    private final String lowerPattern;

    public NameMatcher(String pattern) {
        if (pattern.isBlank()) {
            throw new IllegalArgumentException("Search pattern must not be blank");
        }
        this.pattern = pattern;
        this.lowerPattern = pattern.toLowerCase(Locale.ROOT);
    }

    public String pattern() {
        return pattern;
    }

    public boolean matches(String name) {
        var lowerName = name.toLowerCase(Locale.ROOT);
        return lowerName.contains(lowerPattern) || isSubsequence(lowerPattern, lowerName);
    }

    static boolean isSubsequence(String needle, String haystack) {
        int i = 0;
        for (int j = 0; i < needle.length() && j < haystack.length(); j++) {
            if (needle.charAt(i) == haystack.charAt(j)) {
                i++;
            }
        }
        return i == needle.length();
    }

    public int distance(String name) {
        return LEVENSHTEIN.apply(name.toLowerCase(Locale.ROOT), lowerPattern);
    }

    public Comparator<SymbolMatch> ranking() {
        return Comparator.<SymbolMatch, Boolean>comparing(m -> !m.name().equalsIgnoreCase(pattern))
                .thenComparingInt(m -> distance(m.name()));
    }

    /** Stable sort: equally ranked matches keep their discovery order. */
    public List<SymbolMatch> rank(List<SymbolMatch> matches) {
        return matches.stream().sorted(ranking()).toList();
    }
}
