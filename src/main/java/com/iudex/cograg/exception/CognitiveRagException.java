package com.iudex.cograg.exception;

/**
 * Base type for failures raised inside the retrieval and reasoning engine.
 *
 * <p>All subclasses are unchecked. Recoverable ones are caught at the component that
 * owns the fallback; only {@link BudgetExceededException} is allowed to unwind a whole request.</p>
 */
public class CognitiveRagException extends RuntimeException {

    public CognitiveRagException(String message) {
        super(message);
    }

    public CognitiveRagException(String message, Throwable cause) {
        super(message, cause);
    }
}
