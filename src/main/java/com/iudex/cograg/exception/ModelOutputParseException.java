package com.iudex.cograg.exception;

/**
 * Structured model output could not be parsed. Handled exactly like a failed model call.
 */
public class ModelOutputParseException extends LanguageModelException {

    public ModelOutputParseException(String message) {
        super(message);
    }

    public ModelOutputParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
