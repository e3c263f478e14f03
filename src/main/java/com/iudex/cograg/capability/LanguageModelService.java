package com.iudex.cograg.capability;

import reactor.core.publisher.Flux;

/**
 * Text-generation capability.
 *
 * <p>The blocking form serves internal calls (classification, decomposition, scoring); the
 * streaming form serves the user-facing answer. Implementations signal failure with
 * {@link com.iudex.cograg.exception.LanguageModelException}.</p>
 */
public interface LanguageModelService {

    String complete(String prompt, int maxTokens, double temperature);

    Flux<String> stream(String prompt, int maxTokens, double temperature);

    default boolean isAvailable() {
        return true;
    }
}
