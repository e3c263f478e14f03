package com.iudex.cograg.exception;

/**
 * A retrieval backend failed, timed out or refused the call.
 */
public class BackendUnavailableException extends CognitiveRagException {
    private final String backend;

    public BackendUnavailableException(String backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendUnavailableException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return this.backend;
    }
}
