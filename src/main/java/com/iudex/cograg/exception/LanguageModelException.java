package com.iudex.cograg.exception;

/**
 * The language-model capability failed to produce a usable completion.
 */
public class LanguageModelException extends CognitiveRagException {

    public LanguageModelException(String message) {
        super(message);
    }

    public LanguageModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
