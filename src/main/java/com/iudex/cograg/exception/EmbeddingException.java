package com.iudex.cograg.exception;

public class EmbeddingException extends CognitiveRagException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
