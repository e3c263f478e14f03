package com.iudex.cograg.rag.cograg.refiner;

import com.iudex.cograg.constant.LegalPatterns;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Marker vocabulary for Portuguese and English legal text.
 *
 * <p>Two rules: a negation or prohibition marker present in exactly one of the texts, and a
 * reference cited by both texts with a favourable verdict on one side and an unfavourable one on
 * the other. Every rule is an exclusive-or over the pair, so the result does not depend on order.</p>
 */
@Component
public class LegalContradictionPolicy implements ContradictionPolicy {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;
    private static final Map<String, Pattern> NEGATION_MARKERS = new LinkedHashMap<>();
    private static final Pattern POSITIVE_VERDICT = Pattern.compile(
            "\\b(?:permit\\w*|autoriz\\w*|válid[oa]s?|cabíve(?:l|is)|aplicáve(?:l|is)|allow(?:s|ed)?|valid|admissible|applicable)\\b", FLAGS);
    private static final Pattern NEGATIVE_VERDICT = Pattern.compile(
            "\\b(?:veda\\w*|vedad[oa]s?|proíb\\w*|proib\\w*|inválid[oa]s?|incabíve(?:l|is)|inaplicáve(?:l|is)|prohibit\\w*|forbid\\w*|invalid|inadmissible|inapplicable)\\b", FLAGS);

    static {
        NEGATION_MARKERS.put("negated applicability", Pattern.compile(
                "\\bnão\\s+(?:se\\s+)?(?:aplica|incide|cabe)\\w*|\\b(?:does|do)\\s+not\\s+apply\\b|\\bnot\\s+applicable\\b", FLAGS));
        NEGATION_MARKERS.put("explicit prohibition", Pattern.compile(
                "\\b(?:vedad[oa]s?|proibid[oa]s?|impossível|prohibited|forbidden|impossible)\\b", FLAGS));
        NEGATION_MARKERS.put("inverted meaning", Pattern.compile(
                "\\b(?:contrári[oa]s?|opost[oa]s?|invers[oa]s?|contrary|opposite)\\b", FLAGS));
        NEGATION_MARKERS.put("exclusion", Pattern.compile(
                "\\b(?:exceto|salvo|excluíd[oa]s?|except|excluded|unless)\\b", FLAGS));
    }

    @Override
    public List<String> signals(String first, String second) {
        List<String> signals = new ArrayList<>();
        if (first == null || second == null || first.isBlank() || second.isBlank()) {
            return signals;
        }
        for (Map.Entry<String, Pattern> marker : NEGATION_MARKERS.entrySet()) {
            boolean inFirst = marker.getValue().matcher(first).find();
            boolean inSecond = marker.getValue().matcher(second).find();
            if (inFirst != inSecond) {
                signals.add(marker.getKey());
            }
        }
        Set<String> shared = new TreeSet<>(LegalPatterns.extractReferences(first));
        shared.retainAll(LegalPatterns.extractReferences(second));
        if (!shared.isEmpty() && oppositeVerdicts(first, second)) {
            signals.add("opposite verdict on " + String.join(", ", shared));
        }
        return signals;
    }

    private static boolean oppositeVerdicts(String first, String second) {
        boolean firstPositive = POSITIVE_VERDICT.matcher(first).find();
        boolean firstNegative = NEGATIVE_VERDICT.matcher(first).find();
        boolean secondPositive = POSITIVE_VERDICT.matcher(second).find();
        boolean secondNegative = NEGATIVE_VERDICT.matcher(second).find();
        return firstPositive && secondNegative && !secondPositive && !firstNegative
                || firstNegative && secondPositive && !firstPositive && !secondNegative;
    }
}
