package com.iudex.cograg.rag.rerank;

import com.iudex.cograg.exception.CognitiveRagException;

public class RerankException extends CognitiveRagException {

    public RerankException(String message) {
        super(message);
    }

    public RerankException(String message, Throwable cause) {
        super(message, cause);
    }
}
