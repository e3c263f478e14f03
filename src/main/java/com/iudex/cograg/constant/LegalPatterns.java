package com.iudex.cograg.constant;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regular expressions for Brazilian legal reference tokens.
 */
public final class LegalPatterns {
    public static final Pattern CNJ_NUMBER = Pattern.compile("\\b\\d{7}-\\d{2}\\.\\d{4}\\.\\d\\.\\d{2}\\.\\d{4}\\b");

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public static final List<Pattern> REFERENCES = List.of(
            Pattern.compile("\\bart(?:igo)?\\.?\\s*\\d+[º°o]?(?:\\s*,?\\s*§\\s*\\d+[º°o]?)?", FLAGS),
            Pattern.compile("\\blei\\s+(?:complementar\\s+)?(?:n[º°o.]*\\s*)?\\d[\\d.]*(?:/\\d{2,4})?", FLAGS),
            Pattern.compile("\\bs[úu]mula\\s+(?:vinculante\\s+)?(?:n[º°o.]*\\s*)?\\d+", FLAGS),
            Pattern.compile("\\bdecreto(?:-lei)?\\s+(?:n[º°o.]*\\s*)?\\d[\\d.]*(?:/\\d{2,4})?", FLAGS));

    /**
     * Tokens that mark text as legal material; used by the reranker domain boost.
     */
    public static final List<Pattern> DOMAIN_BOOST = List.of(
            Pattern.compile("\\bart\\.?\\s*\\d+", FLAGS),
            Pattern.compile("§\\s*\\d+", FLAGS),
            Pattern.compile("\\binciso\\s+[IVXLCDM]+\\b", FLAGS),
            Pattern.compile("\\blei\\s+n?[º°.]?\\s*[\\d.]+", FLAGS),
            Pattern.compile("\\bs[úu]mula\\s+n?[º°.]?\\s*\\d+", FLAGS),
            Pattern.compile("\\b(?:stf|stj|tst|tse|trf\\d?|tjsp|tjrj|tjmg)\\b", FLAGS),
            CNJ_NUMBER,
            Pattern.compile("\\bc[óo]digo\\s+(?:civil|penal|de\\s+processo|tribut[áa]rio)", FLAGS),
            Pattern.compile("\\bconstitui[çc][ãa]o\\s+federal\\b", FLAGS),
            Pattern.compile("\\bjurisprud[êe]ncia\\b", FLAGS),
            Pattern.compile("\\bac[óo]rd[ãa]o\\b", FLAGS),
            Pattern.compile("\\brecurso\\s+(?:especial|extraordin[áa]rio|ordin[áa]rio)\\b", FLAGS),
            Pattern.compile("\\bhabeas\\s+corpus\\b", FLAGS),
            Pattern.compile("\\bmandado\\s+de\\s+seguran[çc]a\\b", FLAGS),
            Pattern.compile("\\ba[çc][ãa]o\\s+(?:civil|penal|popular|direta)\\b", FLAGS),
            Pattern.compile("\\bcontrato\\s+administrativo\\b", FLAGS),
            Pattern.compile("\\blicita[çc][ãa]o\\b", FLAGS),
            Pattern.compile("\\bpreg[ãa]o\\s+(?:eletr[ôo]nico|presencial)\\b", FLAGS));

    private LegalPatterns() {
    }

    /**
     * Extracts reference tokens in normalized form (lower case, single spaces) for comparisons.
     */
    public static Set<String> extractReferences(String text) {
        Set<String> refs = new LinkedHashSet<>();
        for (String raw : extractCitations(text)) {
            refs.add(normalizeReference(raw));
        }
        return refs;
    }

    /**
     * Extracts reference tokens as written, in order of appearance.
     */
    public static List<String> extractCitations(String text) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        for (Pattern pattern : REFERENCES) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                found.add(matcher.group().trim());
            }
        }
        return found;
    }

    public static String normalizeReference(String reference) {
        if (reference == null) {
            return "";
        }
        String normalized = reference.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        while (normalized.endsWith(".") || normalized.endsWith(",")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    public static int countDomainMatches(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int count = 0;
        for (Pattern pattern : DOMAIN_BOOST) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                count++;
            }
        }
        return count;
    }
}
