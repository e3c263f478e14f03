package com.iudex.cograg.constant;

import java.util.Set;

public final class StopWords {
    /**
     * Portuguese and English function words dropped before consultation keyword extraction.
     */
    public static final Set<String> CONSULTATION_KEYWORDS = Set.of(
            "o", "a", "os", "as", "um", "uma", "uns", "umas", "de", "da", "do", "das", "dos",
            "em", "na", "no", "nas", "nos", "para", "por", "com", "sem", "sobre", "entre", "até",
            "como", "que", "qual", "quais", "quando", "onde", "porque", "porquê", "e", "ou", "mas",
            "se", "não", "é", "são", "foi", "foram", "ser", "estar", "ter", "haver", "pode", "podem",
            "deve", "devem",
            "the", "and", "for", "was", "are", "what", "where", "when", "who", "how", "why",
            "which", "with", "from", "about", "does", "can", "should", "this", "that"
    );

    private StopWords() {
    }
}
