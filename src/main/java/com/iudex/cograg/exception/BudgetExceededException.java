package com.iudex.cograg.exception;

/**
 * The request ran out of time or model budget. Fatal for the current request only.
 */
public class BudgetExceededException extends CognitiveRagException {
    private final String stage;

    public BudgetExceededException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public String getStage() {
        return this.stage;
    }
}
