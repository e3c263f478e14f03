package com.iudex.cograg.rag.cograg.verifier;

import com.iudex.cograg.constant.LegalPatterns;
import com.iudex.cograg.model.FusedResult;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based grounding check of one leaf answer against the evidence it was built from.
 *
 * <p>Every {@code [ref:id]} marker must name a chunk of the evidence, and every article, statute,
 * precedent and CNJ case number the answer cites must appear in the evidence text. Statute numbers
 * match with or without thousands separators and year, so "Lei 8.112/90" is grounded by
 * "Lei 8112 de 1990". Answers that decline to answer are not checked for citations.</p>
 */
final class CitationGroundingCheck {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final Pattern REF_MARKER = Pattern.compile("\\[ref:([^\\]\\s]+)\\]");
    private static final Pattern ARTICLE = Pattern.compile("\\bart(?:igo)?\\.?\\s*(\\d{1,4})(?!\\d)", FLAGS);
    private static final Pattern STATUTE = Pattern.compile("\\blei\\s+(?:complementar\\s+)?(?:n[º°o.]*\\s*)?(\\d[\\d.]*)(?:/\\d{2,4})?", FLAGS);
    private static final Pattern PRECEDENT = Pattern.compile("\\bs[úu]mula\\s+(?:vinculante\\s+)?(?:n[º°o.]*\\s*)?(\\d{1,4})(?!\\d)", FLAGS);
    private static final List<String> DECLINE_MARKERS = List.of(
            "não encontrei evidência suficiente",
            "não há evidência suficiente",
            "as fontes não respondem",
            "as fontes não tratam",
            "sources do not answer",
            "insufficient evidence");

    private CitationGroundingCheck() {
    }

    /**
     * Problems found, one message per ungrounded reference; empty when the answer is grounded.
     */
    static List<String> check(String answer, List<FusedResult> evidence) {
        List<String> problems = new ArrayList<>();
        if (answer == null || answer.isBlank()) {
            return problems;
        }
        Set<String> evidenceIds = new LinkedHashSet<>();
        StringBuilder joined = new StringBuilder();
        for (FusedResult chunk : evidence) {
            if (chunk.id() != null) {
                evidenceIds.add(chunk.id());
            }
            if (chunk.text() != null) {
                joined.append(chunk.text()).append('\n');
            }
        }
        Matcher refs = REF_MARKER.matcher(answer);
        Set<String> reported = new LinkedHashSet<>();
        while (refs.find()) {
            String id = refs.group(1);
            if (!evidenceIds.contains(id) && reported.add(id)) {
                problems.add("reference marker [ref:" + id + "] does not match any evidence chunk");
            }
        }
        if (declines(answer)) {
            return problems;
        }
        String text = joined.toString();
        for (String number : groups(ARTICLE, answer)) {
            if (!articlePattern(number).matcher(text).find()) {
                problems.add("art. " + number + " is not in the evidence");
            }
        }
        for (String number : groups(STATUTE, answer)) {
            if (!statutePattern(number).matcher(text).find()) {
                problems.add("Lei " + number + " is not in the evidence");
            }
        }
        for (String number : groups(PRECEDENT, answer)) {
            if (!precedentPattern(number).matcher(text).find()) {
                problems.add("Súmula " + number + " is not in the evidence");
            }
        }
        Matcher cnj = LegalPatterns.CNJ_NUMBER.matcher(answer);
        while (cnj.find()) {
            if (!text.contains(cnj.group())) {
                problems.add("case number " + cnj.group() + " is not in the evidence");
            }
        }
        return problems;
    }

    static boolean declines(String answer) {
        String lower = answer.toLowerCase(Locale.ROOT);
        for (String marker : DECLINE_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> groups(Pattern pattern, String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String number = stripSeparators(matcher.group(1));
            if (!number.isEmpty()) {
                found.add(number);
            }
        }
        return found;
    }

    private static Pattern articlePattern(String number) {
        return Pattern.compile("\\bart(?:igo)?\\.?\\s*0*" + number + "(?!\\d)", FLAGS);
    }

    // "8112" matches 8.112, 8 112 and 8112
    private static Pattern statutePattern(String number) {
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < number.length(); i++) {
            if (i > 0) {
                digits.append("[.\\s]?");
            }
            digits.append(number.charAt(i));
        }
        return Pattern.compile("\\blei\\b.{0,80}?(?<!\\d)" + digits + "(?!\\d)", FLAGS | Pattern.DOTALL);
    }

    private static Pattern precedentPattern(String number) {
        return Pattern.compile("\\bs[úu]mula\\b.{0,60}?(?<!\\d)0*" + number + "(?!\\d)", FLAGS | Pattern.DOTALL);
    }

    private static String stripSeparators(String number) {
        String digits = number.replace(".", "");
        int start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }
}
