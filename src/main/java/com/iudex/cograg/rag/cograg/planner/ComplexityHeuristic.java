package com.iudex.cograg.rag.cograg.planner;

import com.iudex.cograg.constant.LegalPatterns;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Decides whether a query is worth decomposing.
 *
 * <p>Thresholds are deployment calibration, not fixed logic: the minimum length and word-count
 * threshold come from configuration, and the pattern sets can be replaced by declaring another
 * bean built with {@link #ComplexityHeuristic(int, int, List, List)}.</p>
 */
@Component
public class ComplexityHeuristic {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    public static final List<Pattern> DEFAULT_SIMPLE_PATTERNS = List.of(
            Pattern.compile("^(?:art\\.?|artigo)\\s*\\d+", FLAGS),
            Pattern.compile("^§\\s*\\d+", FLAGS),
            Pattern.compile("^s[úu]mula\\s+(?:vinculante\\s+)?(?:n[º°.]*\\s*)?\\d+", FLAGS),
            Pattern.compile("^o\\s+que\\s+(?:e|é|significa)\\b", FLAGS),
            Pattern.compile("^qual\\s+(?:e|é)\\s+o\\s+(?:prazo|valor)\\b", FLAGS),
            Pattern.compile("^what\\s+(?:is|does)\\s+(?:art(?:icle)?\\.?\\s*\\d+|the\\s+(?:deadline|meaning))\\b", FLAGS),
            LegalPatterns.CNJ_NUMBER);
    public static final List<Pattern> DEFAULT_COMPLEX_PATTERNS = List.of(
            Pattern.compile("\\be\\b.*\\be\\b", FLAGS),
            Pattern.compile("\\bou\\b.*\\bou\\b", FLAGS),
            Pattern.compile("\\bquais\\b.*\\bdiferen", FLAGS),
            Pattern.compile("\\bdiferen[çc]as?\\s+entre\\b", FLAGS),
            Pattern.compile("\\bcompar", FLAGS),
            Pattern.compile("\\bversus\\b|\\bvs\\.?\\s", FLAGS),
            Pattern.compile("\\bcomo\\b.*\\be\\b.*\\bquando\\b", FLAGS),
            Pattern.compile("\\bresponsabilidad\\w+\\s+\\w+\\s+\\w+", FLAGS),
            Pattern.compile("\\bprescri[çc][ãa]o\\b.*\\binterrup[çc][ãa]o\\b", FLAGS),
            Pattern.compile("\\bnulidad\\w+.*\\bcontrat\\w+", FLAGS),
            Pattern.compile("\\band\\b.*\\band\\b", FLAGS),
            Pattern.compile("\\bdifference\\s+between\\b", FLAGS));

    private final int minQueryLength;
    private final int wordThreshold;
    private final List<Pattern> simplePatterns;
    private final List<Pattern> complexPatterns;

    public ComplexityHeuristic(@Value("${iudex.planner.min-query-length:25}") int minQueryLength,
                               @Value("${iudex.planner.word-threshold:12}") int wordThreshold) {
        this(minQueryLength, wordThreshold, DEFAULT_SIMPLE_PATTERNS, DEFAULT_COMPLEX_PATTERNS);
    }

    public ComplexityHeuristic(int minQueryLength, int wordThreshold, List<Pattern> simplePatterns, List<Pattern> complexPatterns) {
        this.minQueryLength = Math.max(0, minQueryLength);
        this.wordThreshold = Math.max(1, wordThreshold);
        this.simplePatterns = List.copyOf(simplePatterns);
        this.complexPatterns = List.copyOf(complexPatterns);
    }

    public boolean isComplex(String query) {
        if (query == null) {
            return false;
        }
        String normalized = query.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() < this.minQueryLength) {
            return false;
        }
        for (Pattern pattern : this.simplePatterns) {
            if (pattern.matcher(normalized).find()) {
                return false;
            }
        }
        for (Pattern pattern : this.complexPatterns) {
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return normalized.split("\\s+").length > this.wordThreshold;
    }

    public int getMinQueryLength() {
        return this.minQueryLength;
    }

    public int getWordThreshold() {
        return this.wordThreshold;
    }
}
