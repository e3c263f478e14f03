package com.iudex.cograg.rag.memory;

import com.iudex.cograg.constant.StopWords;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword sets and Jaccard similarity used for consultation recall.
 */
public final class KeywordExtractor {
    public static final int MAX_KEYWORDS = 25;
    private static final Pattern WORD = Pattern.compile("\\b\\w{3,}\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private KeywordExtractor() {
    }

    /**
     * Lower-cased words of three or more characters minus stop words, in order of first
     * appearance, at most {@link #MAX_KEYWORDS}.
     */
    public static Set<String> extract(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return keywords;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find() && keywords.size() < MAX_KEYWORDS) {
            String word = matcher.group();
            if (!StopWords.CONSULTATION_KEYWORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    public static double jaccard(Set<String> first, Set<String> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(first);
        intersection.retainAll(second);
        Set<String> union = new HashSet<>(first);
        union.addAll(second);
        return (double) intersection.size() / union.size();
    }
}
