package org.neuralchilli.actionflow.learning;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword extraction and set similarity used to match requests against learned patterns.
 */
public final class KeywordExtractor {

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "from", "up", "about", "into", "through", "during", "before", "after", "above", "below",
            "between", "among", "throughout", "instead"
    );

    private KeywordExtractor() {
    }

    /**
     * Lowercased words longer than two characters, stopwords removed, sorted.
     */
    public static SortedSet<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptySortedSet();
        }

        SortedSet<String> keywords = new TreeSet<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (word.length() > 2 && !STOPWORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    /**
     * Jaccard similarity; 0.0 when either set is empty
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }
}
